package command;

import protocol.CommandFrame;
import protocol.Reply;
import service.StorageService;

/**
 * EXPIRE key seconds
 * 키가 없으면 nil, 있으면 OK를 반환합니다.
 */
public class ExpireCommand implements Command {

    private final StorageService storageService;

    public ExpireCommand(StorageService storageService) {
        this.storageService = storageService;
    }

    @Override
    public Reply execute(CommandFrame frame) {
        if (frame.getArgumentCount() != 2) {
            return CommandErrors.wrongNumberOfArguments("expire");
        }
        long seconds;
        try {
            seconds = CommandErrors.parseInteger(frame.getArgumentAsString(1));
        } catch (NumberFormatException e) {
            return CommandErrors.notAnInteger();
        }
        boolean updated = storageService.expire(frame.getArgumentAsString(0), seconds);
        return updated ? Reply.ok() : Reply.nil();
    }
}
