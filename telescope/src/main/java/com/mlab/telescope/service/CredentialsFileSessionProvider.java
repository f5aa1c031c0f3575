package com.mlab.telescope.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mlab.telescope.config.TelescopeProperties;
import com.mlab.telescope.exception.SessionUnavailableException;
import com.mlab.telescope.model.WarehouseSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Reads a bearer token and project id from a JSON credentials file:
 *
 * <pre>{ "access_token": "ya29...", "project_id": "measurement-lab" }</pre>
 *
 * The session is read once and reused for the rest of the run.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CredentialsFileSessionProvider implements SessionProvider {

    private final TelescopeProperties properties;
    private final ObjectMapper objectMapper;

    private volatile WarehouseSession session;

    @Override
    public WarehouseSession getSession() {
        WarehouseSession current = session;
        if (current == null) {
            synchronized (this) {
                if (session == null) {
                    session = readCredentials(Paths.get(properties.getAuth().getCredentialsPath()));
                }
                current = session;
            }
        }
        return current;
    }

    private WarehouseSession readCredentials(Path credentialsPath) {
        if (!Files.exists(credentialsPath)) {
            throw new SessionUnavailableException("No warehouse credentials found at " + credentialsPath);
        }

        JsonNode credentials;
        try {
            credentials = objectMapper.readTree(credentialsPath.toFile());
        } catch (IOException e) {
            throw new SessionUnavailableException("Could not read credentials file " + credentialsPath, e);
        }

        String token = credentials.path("access_token").asText(null);
        String configuredProject = properties.getAuth().getProjectId();
        String projectId = configuredProject != null && !configuredProject.isBlank()
                ? configuredProject
                : credentials.path("project_id").asText(null);

        if (token == null || token.isBlank()) {
            throw new SessionUnavailableException("Credentials file " + credentialsPath + " has no access_token");
        }
        if (projectId == null || projectId.isBlank()) {
            throw new SessionUnavailableException(
                    "Could not find a warehouse project, set telescope.auth.project-id or project_id in "
                            + credentialsPath);
        }

        log.info("Authenticated with the warehouse for project {}", projectId);
        return new WarehouseSession(projectId, token);
    }
}
