package io.github.hydrate.persistence.document;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of the JSON database file: {@code {"users": [...]}}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class DatabaseDocument {

    private List<UserDocument> users = new ArrayList<>();

    public DatabaseDocument() {}

    public DatabaseDocument(List<UserDocument> users) {
        setUsers(users);
    }

    public List<UserDocument> getUsers() { return users; }
    public void setUsers(List<UserDocument> users) {
        this.users = users != null ? users : new ArrayList<>();
    }
}
