package com.example.cronkeeper.domain.action;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * Account a job runs as, resolved once from a user name.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.WRAPPER_OBJECT)
@JsonSubTypes({
        @JsonSubTypes.Type(value = SystemUser.Unix.class, name = "Unix"),
        @JsonSubTypes.Type(value = SystemUser.Windows.class, name = "Windows")
})
public sealed interface SystemUser {

    String username();

    record Unix(int uid, int gid, String username) implements SystemUser {
    }

    record Windows(String username, List<String> groups) implements SystemUser {
    }
}
