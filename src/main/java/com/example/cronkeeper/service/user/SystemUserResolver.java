package com.example.cronkeeper.service.user;

import com.example.cronkeeper.config.CronkeeperProperties;
import com.example.cronkeeper.domain.action.SystemUser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Looks up local accounts by name in the passwd database.
 * <p>
 * Only Linux hosts are supported. An unknown name, an unreadable database or
 * another OS yields no user, and the job then runs as the daemon's own account.
 */
@Slf4j
@Component
public class SystemUserResolver {

    private final Path passwdFile;
    private final String osName;

    @Autowired
    public SystemUserResolver(CronkeeperProperties properties) {
        this(properties.getPasswdFile(), System.getProperty("os.name", ""));
    }

    SystemUserResolver(Path passwdFile, String osName) {
        this.passwdFile = passwdFile;
        this.osName = osName;
    }

    public Optional<SystemUser> resolve(String username) {
        if (username == null || username.isBlank()) {
            return Optional.empty();
        }
        if (!osName.toLowerCase().contains("linux")) {
            log.warn("User lookup is not supported on {}, ignoring user {}", osName, username);
            return Optional.empty();
        }

        try (var lines = Files.lines(passwdFile, StandardCharsets.UTF_8)) {
            var user = lines
                    .filter(line -> !line.isBlank() && !line.startsWith("#"))
                    .map(line -> line.split(":", -1))
                    .filter(fields -> fields.length >= 4 && fields[0].equals(username))
                    .findFirst()
                    .flatMap(fields -> toUnixUser(fields, username));

            if (user.isEmpty()) {
                log.warn("User {} not found in {}", username, passwdFile);
            }
            return user;
        } catch (IOException e) {
            log.warn("Cannot read {}: {}", passwdFile, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<SystemUser> toUnixUser(String[] fields, String username) {
        try {
            var uid = Integer.parseInt(fields[2]);
            var gid = Integer.parseInt(fields[3]);
            log.debug("Resolved user {} to uid {} gid {}", username, uid, gid);
            return Optional.of(new SystemUser.Unix(uid, gid, username));
        } catch (NumberFormatException e) {
            log.warn("Malformed passwd record for user {}", username);
            return Optional.empty();
        }
    }
}
