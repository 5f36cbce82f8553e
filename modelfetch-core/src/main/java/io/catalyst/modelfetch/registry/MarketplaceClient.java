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
import io.catalyst.modelfetch.api.CredentialScope;
import io.catalyst.modelfetch.api.ExpectedHash;
import io.catalyst.modelfetch.api.FailureKind;
import io.catalyst.modelfetch.api.Registry;
import io.catalyst.modelfetch.api.RegistryClient;
import io.catalyst.modelfetch.api.ResolveException;
import io.catalyst.modelfetch.api.ResolvedArtifact;
import okhttp3.OkHttpClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Resolves numeric model identifiers against the community model marketplace API.
///
/// Identifiers are `modelId` or `modelId@versionId`. For a bare model id the latest version is
/// taken from `GET /api/v1/models/{id}`; version details, including the file list, come from
/// `GET /api/v1/model-versions/{versionId}`. A bare id that is unknown as a model id is retried as
/// a version id, since version ids are what the marketplace shows in its download links.
///
/// The artifact keeps the marketplace download URL and a [CredentialScope] limited to the
/// marketplace origin. The download URL normally redirects to presigned storage; the transfer
/// engine follows that redirect without the credential.
public class MarketplaceClient implements RegistryClient {
    private static final Logger logger = LogManager.getLogger(MarketplaceClient.class);
    private static final Pattern IDENTIFIER = Pattern.compile("(\\d+)(?:@(\\d+))?");

    private final String baseUrl;
    private final CredentialScope scope;
    private final UnknownTypePolicy unknownTypePolicy;
    private final RegistryHttp http;

    /// @param client the shared HTTP client
    /// @param baseUrl the marketplace origin, for example `https://civitai.com`
    /// @param token the API token, or null
    /// @param unknownTypePolicy handling of unrecognized model types
    public MarketplaceClient(OkHttpClient client, String baseUrl, String token, UnknownTypePolicy unknownTypePolicy) {
        this.baseUrl = RegistryHttp.trimSlash(baseUrl);
        this.scope = CredentialScope.of(token, this.baseUrl);
        this.unknownTypePolicy = unknownTypePolicy;
        this.http = new RegistryHttp(client, new ObjectMapper());
    }

    @Override
    public Registry registry() {
        return Registry.MARKETPLACE_MODEL;
    }

    @Override
    public ResolvedArtifact resolve(AcquisitionRequest request) throws AcquisitionException {
        Matcher matcher = IDENTIFIER.matcher(request.identifier().trim());
        if (!matcher.matches()) {
            throw new ResolveException("'" + request.identifier() + "' is not a marketplace identifier (modelId or modelId@versionId)");
        }
        String modelId = matcher.group(1);
        String pinnedVersion = matcher.group(2);

        JsonNode model = null;
        JsonNode version;
        if (pinnedVersion != null) {
            model = http.getJson(baseUrl + "/api/v1/models/" + modelId, scope, "model " + modelId);
            version = http.getJson(baseUrl + "/api/v1/model-versions/" + pinnedVersion, scope,
                "model version " + pinnedVersion);
        } else {
            try {
                model = http.getJson(baseUrl + "/api/v1/models/" + modelId, scope, "model " + modelId);
            } catch (ResolveException e) {
                if (e.kind() != FailureKind.NOT_FOUND) {
                    throw e;
                }
                logger.debug("No model {}, trying it as a version id", modelId);
            }
            if (model != null) {
                JsonNode latest = model.path("modelVersions").path(0);
                if (!latest.hasNonNull("id")) {
                    throw new ResolveException("model " + modelId + " has no versions");
                }
                version = http.getJson(baseUrl + "/api/v1/model-versions/" + latest.path("id").asText(), scope,
                    "model version " + latest.path("id").asText());
            } else {
                version = http.getJson(baseUrl + "/api/v1/model-versions/" + modelId, scope,
                    "model or model version " + modelId);
            }
        }

        String type = model != null ? model.path("type").asText(null) : version.path("model").path("type").asText(null);
        ArtifactCategory category = categoryFor(request, type);
        JsonNode file = primaryFile(version, request);

        String versionId = version.path("id").asText(pinnedVersion != null ? pinnedVersion : modelId);
        String fileName = file.path("name").asText(null);
        if (fileName == null || fileName.isBlank() || fileName.contains("/") || fileName.contains("\\")
            || fileName.equals("..") || fileName.equals(".")) {
            throw new ResolveException("model version " + versionId + " has an unusable file name: " + fileName);
        }
        String downloadUrl = file.path("downloadUrl").asText(null);
        if (downloadUrl == null || downloadUrl.isBlank()) {
            downloadUrl = baseUrl + "/api/download/models/" + versionId;
        }
        ExpectedHash hash = ExpectedHash.sha256OrNull(file.path("hashes").path("SHA256").asText(null));
        long size = file.hasNonNull("sizeKB") ? Math.round(file.path("sizeKB").asDouble() * 1024) : -1;
        if (hash == null) {
            logger.warn("{}: marketplace metadata has no SHA256 for {}", request.key(), fileName);
        }

        ResolvedArtifact artifact = ResolvedArtifact.singleFile(request, category,
            new ArtifactFile(fileName, downloadUrl, size, hash), scope);
        logger.info("Resolved {}", artifact);
        return artifact;
    }

    private ArtifactCategory categoryFor(AcquisitionRequest request, String type) throws ResolveException {
        Optional<ArtifactCategory> fromType = ArtifactCategory.forMarketplaceType(type);
        Optional<ArtifactCategory> declared = request.category();
        if (declared.isPresent()) {
            if (fromType.isPresent() && fromType.get() != declared.get()) {
                logger.warn("{} is listed as {} but the marketplace says '{}'; keeping {}", request.key(),
                    declared.get().directoryName(), type, declared.get().directoryName());
            }
            return declared.get();
        }
        if (fromType.isPresent()) {
            return fromType.get();
        }
        if (unknownTypePolicy == UnknownTypePolicy.REJECT) {
            throw new ResolveException(request.key() + " has unrecognized model type '" + type + "'");
        }
        logger.warn("{} has unrecognized model type '{}'; placing it under {}", request.key(), type,
            ArtifactCategory.OTHER.directoryName());
        return ArtifactCategory.OTHER;
    }

    private static JsonNode primaryFile(JsonNode version, AcquisitionRequest request) throws ResolveException {
        JsonNode files = version.path("files");
        if (!files.isArray() || files.size() == 0) {
            throw new ResolveException(request.key() + ": model version has no files");
        }
        for (JsonNode file : files) {
            if (file.path("primary").asBoolean(false)) {
                return file;
            }
        }
        return files.get(0);
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
        int status = http.status(baseUrl + "/api/v1/models?limit=1", scope);
        if (status >= 200 && status < 300) {
            return CredentialStatus.VALID;
        }
        return status == 401 || status == 403 ? CredentialStatus.REJECTED : CredentialStatus.UNKNOWN;
    }

    @Override
    public String toString() {
        return "MarketplaceClient{" + baseUrl + ", " + scope + "}";
    }
}
