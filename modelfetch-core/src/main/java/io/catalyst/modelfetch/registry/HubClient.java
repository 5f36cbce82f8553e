package io.catalyst.modelfetch.registry;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.catalyst.modelfetch.api.AcquisitionException;
import io.catalyst.modelfetch.api.AcquisitionRequest;
import io.catalyst.modelfetch.api.ArtifactCategory;
import io.catalyst.modelfetch.api.ArtifactFile;
import io.catalyst.modelfetch.api.ArtifactLayout;
import io.catalyst.modelfetch.api.CredentialScope;
import io.catalyst.modelfetch.api.ExpectedHash;
import io.catalyst.modelfetch.api.HashAlgorithm;
import io.catalyst.modelfetch.api.Registry;
import io.catalyst.modelfetch.api.RegistryClient;
import io.catalyst.modelfetch.api.ResolveException;
import io.catalyst.modelfetch.api.ResolvedArtifact;
import okhttp3.OkHttpClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/// Resolves hub repository names to a full snapshot of the repository's files.
///
/// The snapshot request is built straight from the name: one listing call,
/// `GET /api/models/{repo}/revision/{revision}?blobs=true`, returns every file with its size and
/// hashes. Downloads are pinned to the commit the listing reports, via
/// `/{repo}/resolve/{commit}/{path}`. LFS files carry a SHA-256; other files carry their git blob id,
/// which is checked as a git blob SHA-1.
///
/// Identifiers are `org/name` or `org/name@revision`; the configured revision applies otherwise.
public class HubClient implements RegistryClient {
    private static final Logger logger = LogManager.getLogger(HubClient.class);
    private static final Pattern REPOSITORY = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*(/[A-Za-z0-9][A-Za-z0-9._-]*)?");

    private final String baseUrl;
    private final String defaultRevision;
    private final CredentialScope scope;
    private final RegistryHttp http;

    /// @param client the shared HTTP client
    /// @param baseUrl the hub origin, for example `https://huggingface.co`
    /// @param token the access token, or null
    /// @param defaultRevision the branch, tag or commit used when the identifier names none
    public HubClient(OkHttpClient client, String baseUrl, String token, String defaultRevision) {
        this.baseUrl = RegistryHttp.trimSlash(baseUrl);
        this.defaultRevision = defaultRevision == null || defaultRevision.isBlank() ? "main" : defaultRevision.trim();
        this.scope = CredentialScope.of(token, this.baseUrl);
        this.http = new RegistryHttp(client, new ObjectMapper());
    }

    @Override
    public Registry registry() {
        return Registry.HUB_REPOSITORY;
    }

    @Override
    public ResolvedArtifact resolve(AcquisitionRequest request) throws AcquisitionException {
        String identifier = request.identifier().trim();
        String repository = identifier;
        String revision = defaultRevision;
        int at = identifier.indexOf('@');
        if (at >= 0) {
            repository = identifier.substring(0, at);
            revision = identifier.substring(at + 1);
        }
        if (!REPOSITORY.matcher(repository).matches() || repository.contains("..") || revision.isBlank()) {
            throw new ResolveException("'" + identifier + "' is not a hub repository name (org/name[@revision])");
        }

        JsonNode listing = http.getJson(baseUrl + "/api/models/" + repository + "/revision/" + encode(revision)
            + "?blobs=true", scope, "repository " + repository + "@" + revision);
        String commit = listing.path("sha").asText(revision);

        List<ArtifactFile> files = new ArrayList<>();
        for (JsonNode sibling : listing.path("siblings")) {
            String path = sibling.path("rfilename").asText(null);
            if (path == null || path.isBlank()) {
                continue;
            }
            JsonNode lfs = sibling.path("lfs");
            long size = lfs.hasNonNull("size") ? lfs.path("size").asLong()
                : sibling.hasNonNull("size") ? sibling.path("size").asLong() : -1;
            ExpectedHash hash = null;
            if (lfs.hasNonNull("sha256")) {
                hash = new ExpectedHash(HashAlgorithm.SHA256, lfs.path("sha256").asText());
            } else if (sibling.hasNonNull("blobId")) {
                hash = new ExpectedHash(HashAlgorithm.GIT_BLOB_SHA1, sibling.path("blobId").asText());
            }
            String url = baseUrl + "/" + repository + "/resolve/" + encode(commit) + "/" + encodePath(path);
            files.add(new ArtifactFile(path, url, size, hash));
        }
        if (files.isEmpty()) {
            throw new ResolveException("repository " + repository + "@" + revision + " has no files");
        }

        ResolvedArtifact artifact = new ResolvedArtifact(request, ArtifactCategory.HUB_SNAPSHOT, repository,
            ArtifactLayout.DIRECTORY, files, scope);
        logger.info("Resolved {} at commit {}", artifact, commit);
        return artifact;
    }

    @Override
    public boolean probe() {
        return http.reachable(baseUrl + "/");
    }

    @Override
    public CredentialStatus validateCredential() {
        if (!scope.hasCredential()) {
            return CredentialStatus.ABSENT;
        }
        int status = http.status(baseUrl + "/api/whoami-v2", scope);
        if (status >= 200 && status < 300) {
            return CredentialStatus.VALID;
        }
        return status == 401 || status == 403 ? CredentialStatus.REJECTED : CredentialStatus.UNKNOWN;
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String encodePath(String path) {
        String[] parts = path.split("/", -1);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                sb.append('/');
            }
            sb.append(encode(parts[i]));
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "HubClient{" + baseUrl + ", revision=" + defaultRevision + ", " + scope + "}";
    }
}
