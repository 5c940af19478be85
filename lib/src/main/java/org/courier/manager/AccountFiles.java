package org.courier.manager;

import org.courier.manager.api.AccountAlreadyExistsException;
import org.courier.manager.api.IncorrectPassphraseException;
import org.courier.manager.api.InvalidServerAddressException;
import org.courier.manager.groups.GroupSignatureScheme;
import org.courier.manager.internal.ManagerImpl;
import org.courier.manager.internal.SessionDependencies;
import org.courier.manager.network.NetworkGateway;
import org.courier.manager.protocol.ServerAddress;
import org.courier.manager.storage.Identity;
import org.courier.manager.storage.SessionState;
import org.courier.manager.storage.StateFile;
import org.courier.manager.storage.StateWriter;
import org.courier.manager.storage.Storage;
import org.courier.manager.util.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.StandardOpenOption;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.function.Supplier;

/**
 * Entry point for creating and opening the account stored in a data directory.
 */
public class AccountFiles {

    private final static Logger logger = LoggerFactory.getLogger(AccountFiles.class);

    private final File dataPath;
    private final Settings settings;
    private final GroupSignatureScheme groupSignatureScheme;
    private final Supplier<NetworkGateway> networkGatewaySupplier;
    private final SecureRandom secureRandom;
    private final Clock clock;

    public AccountFiles(
            final File dataPath,
            final Settings settings,
            final GroupSignatureScheme groupSignatureScheme,
            final Supplier<NetworkGateway> networkGatewaySupplier,
            final SecureRandom secureRandom,
            final Clock clock
    ) {
        this.dataPath = dataPath;
        this.settings = settings;
        this.groupSignatureScheme = groupSignatureScheme;
        this.networkGatewaySupplier = networkGatewaySupplier;
        this.secureRandom = secureRandom;
        this.clock = clock;
    }

    public AccountFiles(
            final File dataPath,
            final Settings settings,
            final GroupSignatureScheme groupSignatureScheme,
            final Supplier<NetworkGateway> networkGatewaySupplier
    ) {
        this(dataPath, settings, groupSignatureScheme, networkGatewaySupplier, new SecureRandom(), Clock.systemUTC());
    }

    public File getDataPath() {
        return dataPath;
    }

    public boolean accountExists() {
        return getStateFile().exists();
    }

    /**
     * Creates a new identity homed on the given server.
     *
     * @param passphrase protects the state file, an empty passphrase leaves it readable with the all-zero key
     */
    public Manager createAccount(
            String server, String passphrase
    ) throws InvalidServerAddressException, AccountAlreadyExistsException, IOException {
        ServerAddress.parse(server, settings.testing());

        IOUtils.createPrivateDirectories(dataPath);
        final var lock = lockAccount();
        try {
            final var stateFile = getStateFile();
            if (stateFile.exists()) {
                throw new AccountAlreadyExistsException("An account already exists in " + dataPath);
            }

            final var identity = Identity.generate(server,
                    groupSignatureScheme.generateGroup(secureRandom),
                    secureRandom);
            final var state = new SessionState(identity);

            final var salt = StateFile.createSalt(secureRandom);
            final var key = StateFile.deriveKey(passphrase, salt, settings.scrypt());
            stateFile.write(StateFile.encrypt(Storage.serialize(state), key, salt, secureRandom));
            logger.info("Created account on {}", server);

            return open(state, stateFile, key, salt, lock);
        } catch (Throwable e) {
            lock.close();
            throw e;
        }
    }

    /**
     * Opens the existing account. The all-zero key is tried first, the passphrase only if that fails.
     */
    public Manager openAccount(String passphrase) throws IncorrectPassphraseException, IOException {
        final var lock = lockAccount();
        try {
            final var stateFile = getStateFile();
            final var contents = stateFile.read();
            final var salt = StateFile.getSalt(contents);

            var key = StateFile.zeroKey();
            byte[] plaintext;
            try {
                plaintext = StateFile.decrypt(contents, key);
            } catch (IncorrectPassphraseException e) {
                if (passphrase == null || passphrase.isEmpty()) {
                    throw e;
                }
                key = StateFile.deriveKey(passphrase, salt, settings.scrypt());
                plaintext = StateFile.decrypt(contents, key);
            }
            final var state = Storage.deserialize(plaintext);
            logger.debug("Loaded account with {} contacts", state.getContacts().size());

            return open(state, stateFile, key, salt, lock);
        } catch (Throwable e) {
            lock.close();
            throw e;
        }
    }

    private Manager open(SessionState state, StateFile stateFile, byte[] key, byte[] salt, Closeable lock) {
        final var stateWriter = new StateWriter(stateFile, key, salt, secureRandom);
        final var dependencies = new SessionDependencies(settings,
                groupSignatureScheme,
                networkGatewaySupplier.get(),
                secureRandom,
                clock);
        return new ManagerImpl(state, stateWriter, dependencies, lock);
    }

    private StateFile getStateFile() {
        return new StateFile(new File(dataPath, "state"));
    }

    private Closeable lockAccount() throws IOException {
        IOUtils.createPrivateDirectories(dataPath);
        final var channel = FileChannel.open(new File(dataPath, "state.lock").toPath(),
                StandardOpenOption.CREATE,
                StandardOpenOption.WRITE);
        try {
            var lock = channel.tryLock();
            if (lock == null) {
                logger.info("Account is in use by another instance, waiting…");
                lock = channel.lock();
                logger.info("Account lock acquired.");
            }
            final var acquired = lock;
            return () -> {
                acquired.release();
                channel.close();
            };
        } catch (IOException e) {
            channel.close();
            throw e;
        }
    }
}
