package command;

import lombok.extern.slf4j.Slf4j;
import protocol.CommandFrame;
import protocol.Reply;
import service.StorageService;

import java.util.HashMap;
import java.util.Map;

/**
 * 모든 명령어를 관리하고, 요청에 맞는 명령어를 찾아 실행하는 핸들러 클래스
 * 저장소 참조 외에는 상태가 없으므로 여러 연결이 하나의 인스턴스를 공유합니다.
 */
@Slf4j
public class CommandHandler {

    private final Map<String, Command> commandMap = new HashMap<>();

    public CommandHandler(StorageService storageService) {
        commandMap.put("SET", new SetCommand(storageService));
        commandMap.put("GET", new GetCommand(storageService));
        commandMap.put("EXPIRE", new ExpireCommand(storageService));
    }

    /**
     * 프레임 하나를 실행하고 응답을 반환합니다. 명령어 오류는 에러 응답이 되며 예외를 던지지 않습니다.
     */
    public Reply handleCommand(CommandFrame frame) {
        Command command = commandMap.get(frame.getName());
        if (command == null) {
            return CommandErrors.unknownCommand(frame.getRawName());
        }

        try {
            return command.execute(frame);
        } catch (RuntimeException e) {
            log.error("Command {} failed", frame.getName(), e);
            String detail = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return Reply.error("ERR " + detail);
        }
    }
}
