package com.p14n.dbevent.peruser;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.p14n.dbevent.broker.DefaultExecutor;
import com.p14n.dbevent.broker.EventServer;
import com.p14n.dbevent.data.ChannelEvent;
import com.p14n.dbevent.data.ConfigData;
import com.p14n.dbevent.data.DbEvent;

import io.opentelemetry.api.OpenTelemetry;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@Timeout(value = 10, unit = TimeUnit.SECONDS)
class PerUserProvisionerTest {

    private EventServer<DbEvent> server;
    private DefaultExecutor executor;
    private DatabaseAdmin admin;
    private PerUserProvisioner provisioner;

    @BeforeEach
    void setUp() throws IOException {
        var config = new ConfigData(Duration.ofSeconds(5), Duration.ofSeconds(60), false);
        server = new EventServer<DbEvent>(config, null, OpenTelemetry.noop()).start();
        executor = new DefaultExecutor(1);
        admin = mock(DatabaseAdmin.class);
        when(admin.getSecurity(anyString())).thenAnswer(i -> JsonNodeFactory.instance.objectNode());
        provisioner = new PerUserProvisioner(server, admin, new PerUserConfig(), executor);
    }

    @AfterEach
    void tearDown() {
        provisioner.close();
        server.close();
        executor.close();
    }

    @Test
    void shouldCreateDatabaseForNewUser() throws Exception {
        provisioner.start();

        server.publish("_users", DbEvent.docUpdated("org.couchdb.user:bob", false));

        verify(admin, timeout(2000)).create("userdb-626f62");
        verify(admin, timeout(2000)).setSecurity(eq("userdb-626f62"), argThat((ObjectNode s) ->
                "bob".equals(s.at("/admins/names/0").asText())
                        && "bob".equals(s.at("/members/names/0").asText())));
    }

    @Test
    void shouldIgnoreOtherChannelsAndDocuments() throws Exception {
        provisioner.start();

        server.publish("other", DbEvent.docUpdated("org.couchdb.user:bob", false));
        server.publish("_users", DbEvent.docUpdated("_design/auth", false));
        server.publish("_users", DbEvent.created());
        server.publish("_users", DbEvent.docUpdated("org.couchdb.user:amy", false));

        verify(admin, timeout(2000)).create("userdb-616d79");
        verify(admin, never()).create("userdb-626f62");
    }

    @Test
    void shouldKeepDatabaseOfDeletedUser() throws Exception {
        provisioner.handle(new ChannelEvent<>("_users", DbEvent.docUpdated("org.couchdb.user:bob", true)));

        verifyNoInteractions(admin);
    }

    @Test
    void shouldNotRewriteSecurityWhenAlreadyOwner() throws Exception {
        when(admin.exists("userdb-626f62")).thenReturn(true);
        ObjectNode owned = JsonNodeFactory.instance.objectNode();
        SecurityObjects.grantOwner(owned, "bob");
        when(admin.getSecurity("userdb-626f62")).thenReturn(owned);

        provisioner.handle(new ChannelEvent<>("_users", DbEvent.docUpdated("org.couchdb.user:bob", false)));

        verify(admin, never()).create(anyString());
        verify(admin, never()).setSecurity(anyString(), any());
    }

    @Test
    void shouldContinueAfterStorageFailure() throws Exception {
        doThrow(new IOException("disk full")).when(admin).create("userdb-626f62");
        provisioner.start();

        server.publish("_users", DbEvent.docUpdated("org.couchdb.user:bob", false));
        server.publish("_users", DbEvent.docUpdated("org.couchdb.user:amy", false));

        verify(admin, timeout(2000)).create("userdb-616d79");
        assertTrue(provisioner.isRunning());
    }

    @Test
    void shouldKeepConsumingAfterUnexpectedFailure() throws Exception {
        when(admin.getSecurity("userdb-626f62")).thenReturn(null);
        provisioner.start();

        server.publish("_users", DbEvent.docUpdated("org.couchdb.user:bob", false));
        server.publish("_users", DbEvent.docUpdated("org.couchdb.user:amy", false));

        verify(admin, timeout(2000)).setSecurity(eq("userdb-616d79"), any());
        assertTrue(provisioner.isRunning());
        assertEquals(1, server.subscriberCount());
    }

    @Test
    void shouldUnregisterOnClose() throws Exception {
        provisioner.start();
        assertEquals(1, server.subscriberCount());

        provisioner.close();

        assertEquals(0, server.subscriberCount());
        assertFalse(provisioner.isRunning());
    }

    @Test
    void shouldRejectSecondStart() {
        provisioner.start();
        assertThrows(IllegalStateException.class, provisioner::start);
    }
}
