package com.p14n.dbevent.peruser;

import java.io.IOException;
import java.util.List;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.p14n.dbevent.broker.AsyncExecutor;
import com.p14n.dbevent.broker.EventServer;
import com.p14n.dbevent.broker.EventServerException;
import com.p14n.dbevent.broker.Mailbox;
import com.p14n.dbevent.broker.Reply;
import com.p14n.dbevent.data.ChannelEvent;
import com.p14n.dbevent.data.DbEvent;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Creates a private database for every user document written to the
 * authentication database, and makes the user its admin and member.
 *
 * <p>
 * The provisioner is an ordinary subscriber of the {@link EventServer}. It
 * listens on the authentication database channel only. Deleted user
 * documents are ignored; their databases are kept. A failure to provision one
 * user is logged and the next change is processed.
 * </p>
 */
public class PerUserProvisioner implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(PerUserProvisioner.class);

    private final EventServer<DbEvent> server;
    private final DatabaseAdmin admin;
    private final PerUserConfig config;
    private final AsyncExecutor executor;
    private Mailbox<DbEvent> mailbox;

    public PerUserProvisioner(EventServer<DbEvent> server, DatabaseAdmin admin, PerUserConfig config,
            AsyncExecutor executor) {
        this.server = server;
        this.admin = admin;
        this.config = config;
        this.executor = executor;
    }

    /**
     * Starts consuming events and subscribes to the authentication database.
     */
    public synchronized void start() {
        if (mailbox != null) {
            throw new IllegalStateException("Provisioner already started");
        }
        mailbox = Mailbox.spawn(executor, "peruser-" + config.authDbName(), this::consume);
        mailbox.termination().whenComplete((ignored, error) -> {
            if (error != null && !(error instanceof InterruptedException)) {
                logger.error("Per-user provisioner stopped", error);
            } else {
                logger.info("Per-user provisioner stopped");
            }
        });
        Reply reply = server.register(mailbox, List.of(config.authDbName()));
        logger.info("Per-user provisioner watching {}: {}", config.authDbName(), reply);
    }

    public synchronized boolean isRunning() {
        return mailbox != null && !mailbox.isTerminated();
    }

    private void consume(Mailbox<DbEvent> inbox) throws InterruptedException {
        while (!Thread.currentThread().isInterrupted()) {
            handle(inbox.take());
        }
    }

    void handle(ChannelEvent<DbEvent> message) {
        DbEvent event = message.event();
        if (!config.authDbName().equals(message.channel()) || !event.isDocumentChange()) {
            return;
        }
        String userName = UserDbNames.userName(event.docId());
        if (userName == null) {
            return;
        }
        if (event.deleted()) {
            logger.debug("User {} deleted, keeping database", userName);
            return;
        }
        String dbName = UserDbNames.userDbName(config.userDbPrefix(), userName);
        try {
            ensureDatabase(dbName, userName);
        } catch (IOException | RuntimeException e) {
            logger.error("Failed to provision database {} for user {}", dbName, userName, e);
        }
    }

    private void ensureDatabase(String dbName, String userName) throws IOException {
        if (!admin.exists(dbName)) {
            logger.info("Creating database {} for user {}", dbName, userName);
            admin.create(dbName);
        }
        ObjectNode security = admin.getSecurity(dbName);
        if (SecurityObjects.grantOwner(security, userName)) {
            admin.setSecurity(dbName, security);
        }
    }

    @Override
    public synchronized void close() {
        if (mailbox == null) {
            return;
        }
        try {
            server.unregister(mailbox);
        } catch (IllegalStateException | EventServerException e) {
            logger.debug("Event server already closed", e);
        }
        mailbox.stop();
    }
}
