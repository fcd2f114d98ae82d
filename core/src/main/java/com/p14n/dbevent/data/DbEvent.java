package com.p14n.dbevent.data;

/**
 * Payload published by the storage layer when a database changes.
 *
 * <p>
 * Database level events carry no document id. Document updates carry the id
 * of the changed document and whether the change was a deletion.
 * </p>
 *
 * @param type    what happened to the database
 * @param docId   id of the changed document, null for database level events
 * @param deleted true when the document change was a deletion
 */
public record DbEvent(Type type, String docId, boolean deleted) {

    public enum Type {
        CREATED,
        DELETED,
        UPDATED,
        DOC_UPDATED
    }

    public static DbEvent created() {
        return new DbEvent(Type.CREATED, null, false);
    }

    public static DbEvent dbDeleted() {
        return new DbEvent(Type.DELETED, null, false);
    }

    public static DbEvent updated() {
        return new DbEvent(Type.UPDATED, null, false);
    }

    public static DbEvent docUpdated(String docId, boolean deleted) {
        if (docId == null) {
            throw new IllegalArgumentException("Document id cannot be null");
        }
        return new DbEvent(Type.DOC_UPDATED, docId, deleted);
    }

    public boolean isDocumentChange() {
        return type == Type.DOC_UPDATED;
    }
}
