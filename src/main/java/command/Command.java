package command;

import protocol.CommandFrame;
import protocol.Reply;

/**
 * 모든 명령어 클래스가 구현해야 하는 공통 인터페이스
 */
public interface Command {

    /**
     * 명령어 실행 로직
     * @param frame 디코딩된 명령어 프레임 (0번은 명령어 이름)
     * @return 클라이언트에게 보낼 응답. 잘못된 인자는 예외 대신 에러 응답으로 반환합니다.
     */
    Reply execute(CommandFrame frame);
}
