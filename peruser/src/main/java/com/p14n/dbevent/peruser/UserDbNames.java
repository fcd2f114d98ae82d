package com.p14n.dbevent.peruser;

import java.nio.charset.StandardCharsets;

/**
 * Naming of per-user databases and recognition of user documents.
 */
public final class UserDbNames {

    /** Id prefix of documents in the authentication database that describe users. */
    public static final String USER_DOC_PREFIX = "org.couchdb.user:";

    private UserDbNames() {
    }

    /**
     * Builds the database name for a user: the prefix followed by every UTF-8
     * byte of the name in lower case hex. Bytes below 0x10 render as a single
     * digit.
     *
     * @param prefix   database name prefix
     * @param userName the user name
     * @return the database name
     */
    public static String userDbName(String prefix, String userName) {
        StringBuilder sb = new StringBuilder(prefix);
        for (byte b : userName.getBytes(StandardCharsets.UTF_8)) {
            sb.append(Integer.toHexString(b & 0xff));
        }
        return sb.toString();
    }

    /**
     * @param docId a document id from the authentication database
     * @return the user name, or null if the document is not a user document
     */
    public static String userName(String docId) {
        if (docId == null || !docId.startsWith(USER_DOC_PREFIX)) {
            return null;
        }
        return docId.substring(USER_DOC_PREFIX.length());
    }
}
