package com.contact.resolution.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A contact row as held in the local store, together with its email and phone child rows.
 * Instances are immutable; use {@link #toBuilder()} to derive a modified copy.
 */
public class ContactRecord {
    private final String id;
    private final String firstName;
    private final String lastName;
    private final String jobTitle;
    private final String linkedin;
    private final String website;
    private final String birthday;
    private final List<String> emails;
    private final List<PhoneEntry> phones;
    private final String fullData;
    private final String recordHash;
    private final String lastSyncedAt;
    private final DuplicateGroup duplicateGroup;

    private ContactRecord(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.firstName = builder.firstName;
        this.lastName = builder.lastName;
        this.jobTitle = builder.jobTitle;
        this.linkedin = builder.linkedin;
        this.website = builder.website;
        this.birthday = builder.birthday;
        this.emails = List.copyOf(builder.emails);
        this.phones = List.copyOf(builder.phones);
        this.fullData = builder.fullData;
        this.recordHash = builder.recordHash;
        this.lastSyncedAt = builder.lastSyncedAt;
        this.duplicateGroup = builder.duplicateGroup != null ? builder.duplicateGroup : DuplicateGroup.none();
    }

    public String getId() {
        return id;
    }

    public String getFirstName() {
        return firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public String getJobTitle() {
        return jobTitle;
    }

    public String getLinkedin() {
        return linkedin;
    }

    public String getWebsite() {
        return website;
    }

    /**
     * Birthday as delivered by the source, normally {@code YYYY-MM-DD}.
     */
    public String getBirthday() {
        return birthday;
    }

    public List<String> getEmails() {
        return emails;
    }

    public List<PhoneEntry> getPhones() {
        return phones;
    }

    /**
     * Canonical JSON snapshot of the source payload.
     */
    public String getFullData() {
        return fullData;
    }

    public String getRecordHash() {
        return recordHash;
    }

    public String getLastSyncedAt() {
        return lastSyncedAt;
    }

    public DuplicateGroup getDuplicateGroup() {
        return duplicateGroup;
    }

    /**
     * First and last name joined by a single space, with missing parts treated as empty.
     */
    public String getFullName() {
        return (firstName != null ? firstName : "") + " " + (lastName != null ? lastName : "");
    }

    /**
     * Number of non-empty scalar fields, used to pick the most complete record of a cluster.
     */
    public int completeness() {
        int score = 0;
        for (String value : new String[]{firstName, lastName, jobTitle, linkedin, website, birthday, fullData}) {
            if (value != null && !value.isEmpty()) {
                score++;
            }
        }
        return score;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .firstName(firstName)
                .lastName(lastName)
                .jobTitle(jobTitle)
                .linkedin(linkedin)
                .website(website)
                .birthday(birthday)
                .emails(emails)
                .phones(phones)
                .fullData(fullData)
                .recordHash(recordHash)
                .lastSyncedAt(lastSyncedAt)
                .duplicateGroup(duplicateGroup);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ContactRecord that = (ContactRecord) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ContactRecord{" +
                "id='" + id + '\'' +
                ", name='" + getFullName().trim() + '\'' +
                ", emails=" + emails.size() +
                ", phones=" + phones.size() +
                ", group=" + duplicateGroup.groupId() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String firstName;
        private String lastName;
        private String jobTitle;
        private String linkedin;
        private String website;
        private String birthday;
        private List<String> emails = new ArrayList<>();
        private List<PhoneEntry> phones = new ArrayList<>();
        private String fullData;
        private String recordHash;
        private String lastSyncedAt;
        private DuplicateGroup duplicateGroup;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder firstName(String firstName) {
            this.firstName = firstName;
            return this;
        }

        public Builder lastName(String lastName) {
            this.lastName = lastName;
            return this;
        }

        public Builder jobTitle(String jobTitle) {
            this.jobTitle = jobTitle;
            return this;
        }

        public Builder linkedin(String linkedin) {
            this.linkedin = linkedin;
            return this;
        }

        public Builder website(String website) {
            this.website = website;
            return this;
        }

        public Builder birthday(String birthday) {
            this.birthday = birthday;
            return this;
        }

        public Builder emails(List<String> emails) {
            this.emails = new ArrayList<>(emails);
            return this;
        }

        public Builder email(String email) {
            this.emails.add(email);
            return this;
        }

        public Builder phones(List<PhoneEntry> phones) {
            this.phones = new ArrayList<>(phones);
            return this;
        }

        public Builder phone(String number, String label) {
            this.phones.add(new PhoneEntry(number, label));
            return this;
        }

        public Builder fullData(String fullData) {
            this.fullData = fullData;
            return this;
        }

        public Builder recordHash(String recordHash) {
            this.recordHash = recordHash;
            return this;
        }

        public Builder lastSyncedAt(String lastSyncedAt) {
            this.lastSyncedAt = lastSyncedAt;
            return this;
        }

        public Builder duplicateGroup(DuplicateGroup duplicateGroup) {
            this.duplicateGroup = duplicateGroup;
            return this;
        }

        public ContactRecord build() {
            return new ContactRecord(this);
        }
    }
}
