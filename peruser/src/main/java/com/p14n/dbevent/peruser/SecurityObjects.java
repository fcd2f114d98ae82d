package com.p14n.dbevent.peruser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Edits database security objects in place.
 */
public final class SecurityObjects {

    public static final String ADMINS = "admins";
    public static final String MEMBERS = "members";

    private SecurityObjects() {
    }

    /**
     * Lists {@code userName} as both admin and member.
     *
     * @return true if the security object changed
     */
    public static boolean grantOwner(ObjectNode security, String userName) {
        boolean admin = addName(security, ADMINS, userName);
        boolean member = addName(security, MEMBERS, userName);
        return admin || member;
    }

    /**
     * Puts {@code userName} at the head of {@code section.names} unless it is
     * already there, creating the section and the list when missing. Other
     * fields such as {@code roles} are left alone.
     *
     * @return true if the name was added
     */
    public static boolean addName(ObjectNode security, String section, String userName) {
        JsonNode existing = security.get(section);
        ObjectNode sectionNode = existing instanceof ObjectNode o ? o : security.putObject(section);
        JsonNode names = sectionNode.get("names");
        ArrayNode nameList = names instanceof ArrayNode a ? a : sectionNode.putArray("names");
        for (JsonNode name : nameList) {
            if (userName.equals(name.asText())) {
                return false;
            }
        }
        nameList.insert(0, userName);
        return true;
    }
}
