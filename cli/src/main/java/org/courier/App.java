package org.courier;

import net.sourceforge.argparse4j.ArgumentParsers;
import net.sourceforge.argparse4j.impl.Arguments;
import net.sourceforge.argparse4j.inf.ArgumentParser;
import net.sourceforge.argparse4j.inf.Namespace;

import org.courier.commands.AccountCommand;
import org.courier.commands.Command;
import org.courier.commands.CommandHandler;
import org.courier.commands.Commands;
import org.courier.commands.LocalCommand;
import org.courier.commands.exceptions.CommandException;
import org.courier.commands.exceptions.IOErrorException;
import org.courier.commands.exceptions.UnexpectedErrorException;
import org.courier.commands.exceptions.UserErrorException;
import org.courier.manager.AccountFiles;
import org.courier.manager.Manager;
import org.courier.manager.Settings;
import org.courier.manager.api.CorruptStateException;
import org.courier.manager.api.IncorrectPassphraseException;
import org.courier.manager.config.ScryptParameters;
import org.courier.manager.groups.GroupSignatureScheme;
import org.courier.manager.network.NetworkGateway;
import org.courier.manager.network.OfflineNetworkGateway;
import org.courier.output.JsonWriterImpl;
import org.courier.output.OutputWriter;
import org.courier.output.PlainTextWriterImpl;
import org.courier.util.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ServiceLoader;

import static net.sourceforge.argparse4j.DefaultSettings.VERSION_0_9_0_DEFAULT_SETTINGS;

public class App {

    private final static Logger logger = LoggerFactory.getLogger(App.class);

    private final Namespace ns;

    static ArgumentParser buildArgumentParser() {
        var parser = ArgumentParsers.newFor("courier", VERSION_0_9_0_DEFAULT_SETTINGS)
                .includeArgumentNamesAsKeysInResult(true)
                .build()
                .defaultHelp(true)
                .description("Commandline interface for a store-and-forward messenger.")
                .version(BaseConfig.PROJECT_NAME + " " + BaseConfig.PROJECT_VERSION);

        parser.addArgument("--version").help("Show package version.").action(Arguments.version());
        parser.addArgument("-v", "--verbose")
                .help("Raise log level. Specify multiple times for even more logs.")
                .action(Arguments.count());
        parser.addArgument("--log-file")
                .type(File.class)
                .help("Write log output to the given file. If --verbose is also given, the detailed logs will only be written to the log file.");
        parser.addArgument("--scrub-log")
                .action(Arguments.storeTrue())
                .help("Scrub possibly sensitive information from the log, like key material and message ids.");
        parser.addArgument("-c", "--config")
                .help("Set the path, where to store the account state (Default: $XDG_DATA_HOME/courier , $HOME/.local/share/courier).");
        parser.addArgument("--passphrase-file")
                .type(File.class)
                .help("Read the state file passphrase from the given file (Default: $"
                        + BaseConfig.PASSPHRASE_ENVIRONMENT_VARIABLE
                        + ", otherwise no passphrase).");
        parser.addArgument("--testing")
                .action(Arguments.storeTrue())
                .help("Accept non-onion server addresses with an explicit port.");

        parser.addArgument("-o", "--output")
                .help("Choose to output in plain text or JSON")
                .type(Arguments.enumStringType(OutputType.class));

        var subparsers = parser.addSubparsers().title("subcommands").dest("command");

        Commands.getCommandSubparserAttachers().forEach((key, value) -> {
            var subparser = subparsers.addParser(key);
            value.attachToSubparser(subparser);
        });

        return parser;
    }

    public App(final Namespace ns) {
        this.ns = ns;
    }

    public void init() throws CommandException {
        logger.debug("Starting {}", BaseConfig.PROJECT_NAME + " " + BaseConfig.PROJECT_VERSION);
        var commandKey = ns.getString("command");
        var command = Commands.getCommand(commandKey);
        if (command == null) {
            throw new UserErrorException("Command not implemented!");
        }

        final var outputWriter = getOutputWriter(command);
        final var commandHandler = new CommandHandler(ns, outputWriter);

        final var accountFiles = loadAccountFiles();

        handleCommand(command, commandHandler, accountFiles);
    }

    private void handleCommand(
            final Command command, final CommandHandler commandHandler, final AccountFiles accountFiles
    ) throws CommandException {
        if (command instanceof AccountCommand accountCommand) {
            commandHandler.handleAccountCommand(accountCommand, accountFiles, getPassphrase());
            return;
        }

        if (command instanceof LocalCommand localCommand) {
            if (!accountFiles.accountExists()) {
                throw new UserErrorException("No account found in "
                        + accountFiles.getDataPath()
                        + ", you first need to create one with createAccount");
            }
            try (var m = loadManager(accountFiles)) {
                commandHandler.handleLocalCommand(localCommand, m);
            }
            return;
        }

        throw new UserErrorException("Command is not supported");
    }

    private OutputWriter getOutputWriter(final Command command) throws UserErrorException {
        final var outputTypeInput = ns.<OutputType>get("output");
        final var outputType = outputTypeInput == null ? command.getSupportedOutputTypes()
                .stream()
                .findFirst()
                .orElse(null) : outputTypeInput;
        final var writer = new BufferedWriter(new OutputStreamWriter(System.out, IOUtils.getConsoleCharset()));
        final var outputWriter = outputType == null
                ? null
                : outputType == OutputType.JSON ? new JsonWriterImpl(writer) : new PlainTextWriterImpl(writer);

        if (outputWriter != null && !command.getSupportedOutputTypes().contains(outputType)) {
            throw new UserErrorException("Command doesn't support output type " + outputType);
        }
        return outputWriter;
    }

    private AccountFiles loadAccountFiles() throws UserErrorException {
        final File configPath;
        final var config = ns.getString("config");
        if (config != null) {
            configPath = new File(config);
        } else {
            configPath = getDefaultConfigPath();
        }

        final var testing = Boolean.TRUE.equals(ns.getBoolean("testing"));
        final var settings = new Settings(testing, ScryptParameters.DEFAULT);

        return new AccountFiles(configPath, settings, loadGroupSignatureScheme(), App::loadNetworkGateway);
    }

    private Manager loadManager(final AccountFiles accountFiles) throws CommandException {
        logger.trace("Loading state file from {}", accountFiles.getDataPath());
        try {
            return accountFiles.openAccount(getPassphrase());
        } catch (IncorrectPassphraseException e) {
            throw new UserErrorException("Incorrect passphrase for the state file", e);
        } catch (CorruptStateException e) {
            throw new UnexpectedErrorException("State file is corrupt: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new IOErrorException("Error loading state file: " + e.getMessage(), e);
        }
    }

    private String getPassphrase() throws IOErrorException {
        final var passphraseFile = ns.<File>get("passphrase-file");
        if (passphraseFile == null) {
            return System.getenv(BaseConfig.PASSPHRASE_ENVIRONMENT_VARIABLE);
        }
        try {
            return IOUtils.stripTrailingNewline(Files.readString(passphraseFile.toPath(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IOErrorException("Failed to read passphrase file: " + e.getMessage(), e);
        }
    }

    private static GroupSignatureScheme loadGroupSignatureScheme() throws UserErrorException {
        return ServiceLoader.load(GroupSignatureScheme.class)
                .findFirst()
                .orElseThrow(() -> new UserErrorException("No group signature scheme implementation available"));
    }

    private static NetworkGateway loadNetworkGateway() {
        return ServiceLoader.load(NetworkGateway.class).findFirst().orElseGet(() -> {
            logger.debug("No network transport available, running offline");
            return new OfflineNetworkGateway();
        });
    }

    /**
     * @return the default data directory to be used by courier.
     */
    private static File getDefaultConfigPath() {
        return new File(IOUtils.getDataHomeDir(), BaseConfig.DATA_DIRECTORY_NAME);
    }
}
