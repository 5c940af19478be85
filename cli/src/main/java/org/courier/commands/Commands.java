package org.courier.commands;

import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

public class Commands {

    private static final Map<String, Command> commands = new HashMap<>();
    private static final Map<String, SubparserAttacher> commandSubparserAttacher = new TreeMap<>();

    static {
        addCommand(new AckMessageCommand());
        addCommand(new AddContactCommand());
        addCommand(new CompleteHandshakeCommand());
        addCommand(new CreateAccountCommand());
        addCommand(new DaemonCommand());
        addCommand(new EstimateUsageCommand());
        addCommand(new FetchCommand());
        addCommand(new ListContactsCommand());
        addCommand(new ListMessagesCommand());
        addCommand(new ReadMessageCommand());
        addCommand(new SendCommand());
        addCommand(new ShowHandshakeCommand());
        addCommand(new ShowIdentityCommand());
    }

    public static Map<String, SubparserAttacher> getCommandSubparserAttachers() {
        return commandSubparserAttacher;
    }

    public static Command getCommand(String commandKey) {
        if (!commands.containsKey(commandKey)) {
            return null;
        }
        return commands.get(commandKey);
    }

    private static void addCommand(Command command) {
        commands.put(command.getName(), command);
        if (command instanceof CliCommand) {
            commandSubparserAttacher.put(command.getName(), ((CliCommand) command)::attachToSubparser);
        }
    }
}
