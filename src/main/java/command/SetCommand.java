package command;

import protocol.CommandFrame;
import protocol.Reply;
import service.StorageService;

/**
 * SET key value [EX seconds]
 */
public class SetCommand implements Command {

    private final StorageService storageService;

    public SetCommand(StorageService storageService) {
        this.storageService = storageService;
    }

    @Override
    public Reply execute(CommandFrame frame) {
        if (frame.getArgumentCount() < 2) {
            return CommandErrors.wrongNumberOfArguments("set");
        }

        String key = frame.getArgumentAsString(0);
        byte[] value = frame.getArgument(1);
        long ttlSeconds = -1;

        for (int i = 2; i < frame.getArgumentCount(); i++) {
            String option = frame.getArgumentAsString(i);
            if (!"EX".equalsIgnoreCase(option) || ttlSeconds != -1 || i + 1 >= frame.getArgumentCount()) {
                return CommandErrors.syntaxError();
            }
            try {
                ttlSeconds = CommandErrors.parseInteger(frame.getArgumentAsString(++i));
            } catch (NumberFormatException e) {
                return CommandErrors.notAnInteger();
            }
            if (ttlSeconds <= 0) {
                return Reply.error("ERR invalid expire time in 'set' command");
            }
        }

        if (ttlSeconds != -1) {
            storageService.set(key, value, ttlSeconds);
        } else {
            storageService.set(key, value);
        }
        return Reply.ok();
    }
}
