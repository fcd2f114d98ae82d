package com.p14n.dbevent.peruser;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SecurityObjectsTest {

    private final ObjectMapper mapper = new ObjectMapper();

    private ObjectNode parse(String json) throws Exception {
        return (ObjectNode) mapper.readTree(json);
    }

    @Test
    void shouldCreateSectionsOnEmptyObject() throws Exception {
        ObjectNode security = mapper.createObjectNode();

        assertTrue(SecurityObjects.grantOwner(security, "bob"));

        assertEquals(parse("{\"admins\":{\"names\":[\"bob\"]},\"members\":{\"names\":[\"bob\"]}}"), security);
    }

    @Test
    void shouldPrependAndKeepRoles() throws Exception {
        ObjectNode security = parse(
                "{\"admins\":{\"names\":[\"alice\"],\"roles\":[\"ops\"]},\"members\":{\"roles\":[\"staff\"]}}");

        assertTrue(SecurityObjects.grantOwner(security, "bob"));

        assertEquals("bob", security.at("/admins/names/0").asText());
        assertEquals("alice", security.at("/admins/names/1").asText());
        assertEquals("ops", security.at("/admins/roles/0").asText());
        assertEquals("bob", security.at("/members/names/0").asText());
        assertEquals("staff", security.at("/members/roles/0").asText());
    }

    @Test
    void shouldReportNoChangeWhenAlreadyOwner() throws Exception {
        ObjectNode security = parse("{\"admins\":{\"names\":[\"bob\"]},\"members\":{\"names\":[\"bob\"]}}");
        ObjectNode before = security.deepCopy();

        assertFalse(SecurityObjects.grantOwner(security, "bob"));
        assertEquals(before, security);
    }

    @Test
    void shouldAddOnlyMissingSection() throws Exception {
        ObjectNode security = parse("{\"admins\":{\"names\":[\"bob\"]}}");

        assertTrue(SecurityObjects.grantOwner(security, "bob"));
        assertEquals(1, security.at("/admins/names").size());
        assertEquals("bob", security.at("/members/names/0").asText());
    }
}
