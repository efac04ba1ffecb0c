package command;

import protocol.CommandFrame;
import protocol.Reply;
import service.StorageService;

public class GetCommand implements Command {

    private final StorageService storageService;

    public GetCommand(StorageService storageService) {
        this.storageService = storageService;
    }

    @Override
    public Reply execute(CommandFrame frame) {
        if (frame.getArgumentCount() != 1) {
            return CommandErrors.wrongNumberOfArguments("get");
        }
        byte[] value = storageService.get(frame.getArgumentAsString(0));
        return value == null ? Reply.nil() : Reply.bulk(value);
    }
}
