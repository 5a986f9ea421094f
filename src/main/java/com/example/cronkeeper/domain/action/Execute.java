package com.example.cronkeeper.domain.action;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * What to run for an {@link Action.Exec} action.
 * Every field except {@code executable} is optional.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Execute {

    private String executable;

    private List<String> args;

    /**
     * Variables merged over the daemon's own environment
     */
    private Map<String, String> env;

    private String workingDir;

    /**
     * Account snapshot taken when the entry was created
     */
    private SystemUser user;
}
