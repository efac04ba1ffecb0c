package protocol;

import java.io.IOException;

/**
 * RESP 프레임 형식이 잘못되었을 때 발생하는 예외
 * 데이터가 아직 부족한 경우(incomplete)와는 구분되며, 연결을 종료시킵니다.
 */
public class ProtocolException extends IOException {

    public ProtocolException(String message) {
        super(message);
    }
}
