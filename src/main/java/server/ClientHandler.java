package server;

import command.CommandHandler;
import lombok.extern.slf4j.Slf4j;
import protocol.CommandFrame;
import protocol.ProtocolException;
import protocol.Reply;
import protocol.RespFrameDecoder;
import protocol.RespProtocol;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.net.SocketException;
import java.util.Optional;

/**
 * 클라이언트 연결 하나를 처리하는 핸들러
 * 읽기 → 디코딩 → 명령 실행 → 인코딩 → 쓰기를 연결이 끊길 때까지 반복합니다.
 */
@Slf4j
public class ClientHandler implements Runnable {

    private static final int READ_BUFFER_SIZE = 4096;

    private final Socket clientSocket;
    private final CommandHandler commandHandler;
    private final RespFrameDecoder decoder = new RespFrameDecoder();

    public ClientHandler(Socket clientSocket, CommandHandler commandHandler) {
        this.clientSocket = clientSocket;
        this.commandHandler = commandHandler;
    }

    @Override
    public void run() {
        String clientAddress = String.valueOf(clientSocket.getRemoteSocketAddress());

        try (InputStream inputStream = clientSocket.getInputStream();
             OutputStream outputStream = new BufferedOutputStream(clientSocket.getOutputStream())) {

            handleClientLoop(inputStream, outputStream, clientAddress);

        } catch (ProtocolException e) {
            log.warn("Protocol error from client {}: {}", clientAddress, e.getMessage());
        } catch (SocketException e) {
            log.info("Client disconnected: {} ({})", clientAddress, e.getMessage());
        } catch (IOException e) {
            log.warn("Error handling client {}: {}", clientAddress, e.getMessage());
        } finally {
            try {
                clientSocket.close();
            } catch (IOException e) {
                log.warn("Error closing client socket {}: {}", clientAddress, e.getMessage());
            }
        }

        log.info("Client connection closed: {}", clientAddress);
    }

    private void handleClientLoop(InputStream inputStream, OutputStream outputStream, String clientAddress) throws IOException {
        byte[] readBuffer = new byte[READ_BUFFER_SIZE];
        int bytesRead;
        while ((bytesRead = inputStream.read(readBuffer)) != -1) {
            try {
                decoder.feed(readBuffer, 0, bytesRead);
                drainFrames(outputStream, clientAddress);
            } catch (ProtocolException e) {
                sendProtocolError(outputStream, e);
                throw e;
            }
            outputStream.flush();
        }
        log.debug("End of stream from {}", clientAddress);
    }

    /**
     * 버퍼에 쌓인 완성된 프레임을 모두 처리합니다. 응답은 프레임 순서대로 기록됩니다.
     */
    private void drainFrames(OutputStream outputStream, String clientAddress) throws IOException {
        Optional<CommandFrame> frame;
        while ((frame = decoder.tryDecode()).isPresent()) {
            CommandFrame command = frame.get();
            log.debug("Received from {}: {}", clientAddress, command);

            Reply reply = commandHandler.handleCommand(command);
            outputStream.write(RespProtocol.encode(reply));
            log.debug("Sent to {}: {}", clientAddress, reply);
        }
    }

    /**
     * 연결을 닫기 전에 에러 응답을 한 번 보내봅니다. 실패해도 연결은 어차피 닫힙니다.
     */
    private void sendProtocolError(OutputStream outputStream, ProtocolException cause) {
        try {
            outputStream.write(RespProtocol.createErrorResponse("ERR Protocol error: " + cause.getMessage()));
            outputStream.flush();
        } catch (IOException e) {
            log.debug("Could not deliver protocol error reply: {}", e.getMessage());
        }
    }
}
