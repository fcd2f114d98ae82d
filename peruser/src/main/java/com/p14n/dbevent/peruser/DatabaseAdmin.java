package com.p14n.dbevent.peruser;

import java.io.IOException;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Administrative access to the storage layer, as needed to provision user
 * databases.
 */
public interface DatabaseAdmin {

    boolean exists(String dbName) throws IOException;

    void create(String dbName) throws IOException;

    /**
     * Reads a database's security object, e.g.
     * {@code {"admins":{"names":[],"roles":[]},"members":{"names":[],"roles":[]}}}.
     * A database without one returns an empty object.
     */
    ObjectNode getSecurity(String dbName) throws IOException;

    void setSecurity(String dbName, ObjectNode security) throws IOException;
}
