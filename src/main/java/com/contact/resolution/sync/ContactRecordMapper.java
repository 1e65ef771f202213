package com.contact.resolution.sync;

import com.contact.resolution.core.model.ContactRecord;
import com.contact.resolution.core.model.DuplicateGroup;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Maps an upstream contact object onto a {@link ContactRecord}.
 * Email entries without an {@code email} and phone entries without a {@code phone_number} are dropped.
 */
public class ContactRecordMapper {

    /**
     * The record's {@code id} as text, or null if it has none.
     */
    public String idOf(JsonNode contact) {
        String id = text(contact, "id");
        return id == null || id.isEmpty() ? null : id;
    }

    public ContactRecord toRecord(JsonNode contact, String canonicalJson, String recordHash,
                                  String syncedAt, DuplicateGroup duplicateGroup) {
        ContactRecord.Builder builder = ContactRecord.builder()
                .id(idOf(contact))
                .firstName(text(contact, "first_name"))
                .lastName(text(contact, "last_name"))
                .jobTitle(text(contact, "job_title"))
                .linkedin(text(contact, "linkedin"))
                .website(text(contact, "website"))
                .birthday(text(contact, "birthday"))
                .fullData(canonicalJson)
                .recordHash(recordHash)
                .lastSyncedAt(syncedAt)
                .duplicateGroup(duplicateGroup);

        for (JsonNode email : contact.path("emails")) {
            String address = text(email, "email");
            if (address != null && !address.isEmpty()) {
                builder.email(address);
            }
        }
        for (JsonNode phone : contact.path("phones")) {
            String number = text(phone, "phone_number");
            if (number != null && !number.isEmpty()) {
                builder.phone(number, text(phone, "label"));
            }
        }
        return builder.build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || value.isContainerNode()) {
            return null;
        }
        return value.asText();
    }
}
