package command;

import protocol.Reply;

/**
 * 명령어들이 공통으로 사용하는 에러 응답과 인자 파싱
 */
final class CommandErrors {

    private CommandErrors() {
    }

    static Reply wrongNumberOfArguments(String command) {
        return Reply.error("ERR wrong number of arguments for '" + command + "' command");
    }

    static Reply notAnInteger() {
        return Reply.error("ERR value is not an integer or out of range");
    }

    static Reply syntaxError() {
        return Reply.error("ERR syntax error");
    }

    static Reply unknownCommand(String name) {
        return Reply.error("ERR unknown command '" + name + "'");
    }

    /**
     * 부호('-'만 허용)와 숫자로만 이루어진 정수를 파싱합니다. "+5", " 5" 등은 거부합니다.
     */
    static long parseInteger(String text) {
        int start = text.startsWith("-") ? 1 : 0;
        if (text.length() == start) {
            throw new NumberFormatException("not an integer: " + text);
        }
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                throw new NumberFormatException("not an integer: " + text);
            }
        }
        return Long.parseLong(text);
    }
}
