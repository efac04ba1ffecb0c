package client;

import config.ServerConfig;
import protocol.Reply;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * 콘솔 클라이언트. 한 줄을 공백으로 나눠 명령어로 보내고 응답을 출력합니다.
 */
public class ClientMain {

    public static void main(String[] args) {
        String host = ServerConfig.DEFAULT_HOST;
        int port = ServerConfig.DEFAULT_PORT;
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--host":
                    if (i + 1 < args.length) {
                        host = args[++i];
                    }
                    break;
                case "--port":
                    if (i + 1 < args.length) {
                        try {
                            port = Integer.parseInt(args[++i]);
                        } catch (NumberFormatException e) {
                            System.err.println("잘못된 포트 번호: " + args[i]);
                            System.exit(2);
                        }
                    }
                    break;
                default:
                    System.err.println("알 수 없는 옵션: " + args[i]);
                    System.exit(2);
            }
        }

        try (RedisClient client = new RedisClient(host, port)) {
            BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            run(client, reader, System.out, host + ":" + port);
        } catch (IOException e) {
            System.err.println("Connection error: " + e.getMessage());
            System.exit(1);
        }
    }

    /**
     * quit/exit 또는 입력 끝까지 명령어를 반복 처리합니다.
     */
    static void run(RedisClient client, BufferedReader reader, PrintStream out, String prompt) throws IOException {
        out.println("Supported commands: SET key value [EX seconds], GET key, EXPIRE key seconds");
        String line;
        while (true) {
            out.print(prompt + "> ");
            out.flush();
            line = reader.readLine();
            if (line == null) {
                break;
            }
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if ("quit".equalsIgnoreCase(trimmed) || "exit".equalsIgnoreCase(trimmed)) {
                break;
            }
            Reply reply = client.execute(trimmed.split("\\s+"));
            out.println(reply);
        }
    }
}
