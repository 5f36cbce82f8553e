package io.catalyst.modelfetch.command;

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

import io.catalyst.modelfetch.pipeline.IdentifierList;
import io.catalyst.modelfetch.pipeline.MarkerPolicy;
import io.catalyst.modelfetch.pipeline.PipelineOrchestrator;
import io.catalyst.modelfetch.pipeline.PipelineSettings;
import io.catalyst.modelfetch.pipeline.RunReport;
import io.catalyst.modelfetch.registry.UnknownTypePolicy;
import io.catalyst.modelfetch.transport.RetryPolicy;
import io.catalyst.modelfetch.transport.TransportSettings;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.function.Function;

/// Acquires the configured models into the storage root and exits with the run status.
///
/// Every option defaults to an environment variable, so a container can be configured either
/// way. Exit codes: 0 success or skipped, 1 hard failure, 2 partial failure, 3 invalid
/// configuration or unusable directories, 124 run deadline exceeded.
///
/// Usage:
/// ```
/// modelfetch [--checkpoints ids][--hf-repos repos][--models-dir dir][--timeout seconds]...
///```
@CommandLine.Command(name = "modelfetch",
    header = "Download models from the model marketplace and the model hub",
    description = """
        Resolves the configured identifiers, downloads them with resumable segmented
        transfers, verifies their hashes and places them atomically under the models
        directory. A completion marker makes repeated starts with the same
        configuration a no-op.
        """,
    mixinStandardHelpOptions = true,
    version = "modelfetch 0.1.0")
public class CMD_modelfetch implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_modelfetch.class);

    /// Exit code for configuration and directory setup errors.
    public static final int EXIT_SETUP_ERROR = 3;

    @CommandLine.Option(names = "--checkpoints", defaultValue = "${env:CIVITAI_CHECKPOINTS_TO_DOWNLOAD}",
        description = "Comma separated marketplace ids placed under checkpoints/")
    private String checkpoints;

    @CommandLine.Option(names = "--loras", defaultValue = "${env:CIVITAI_LORAS_TO_DOWNLOAD}",
        description = "Comma separated marketplace ids placed under loras/")
    private String loras;

    @CommandLine.Option(names = "--vaes", defaultValue = "${env:CIVITAI_VAES_TO_DOWNLOAD}",
        description = "Comma separated marketplace ids placed under vae/")
    private String vaes;

    @CommandLine.Option(names = "--embeddings", defaultValue = "${env:CIVITAI_EMBEDDINGS_TO_DOWNLOAD}",
        description = "Comma separated marketplace ids placed under embeddings/")
    private String embeddings;

    @CommandLine.Option(names = "--controlnets", defaultValue = "${env:CIVITAI_CONTROLNETS_TO_DOWNLOAD}",
        description = "Comma separated marketplace ids placed under controlnet/")
    private String controlnets;

    @CommandLine.Option(names = "--upscalers", defaultValue = "${env:CIVITAI_UPSCALERS_TO_DOWNLOAD}",
        description = "Comma separated marketplace ids placed under upscale_models/")
    private String upscalers;

    @CommandLine.Option(names = "--models", defaultValue = "${env:CIVITAI_MODELS_TO_DOWNLOAD}",
        description = "Comma separated marketplace ids placed by their declared type")
    private String models;

    @CommandLine.Option(names = "--hf-repos", defaultValue = "${env:HF_REPOS_TO_DOWNLOAD}",
        description = "Comma separated hub repositories (org/name[@revision])")
    private String hubRepositories;

    @CommandLine.Option(names = "--civitai-token", defaultValue = "${env:CIVITAI_TOKEN}",
        description = "Marketplace API token")
    private String civitaiToken;

    @CommandLine.Option(names = "--hf-token", defaultValue = "${env:HUGGINGFACE_TOKEN}",
        description = "Hub token; falls back to HF_TOKEN, then ~/.cache/huggingface/token")
    private String hubToken;

    @CommandLine.Option(names = "--timeout", defaultValue = "${env:DOWNLOAD_TIMEOUT:-3600}",
        description = "Deadline for the whole run in seconds (default: ${DEFAULT-VALUE})")
    private long timeoutSeconds;

    @CommandLine.Option(names = "--models-dir", defaultValue = "${env:MODELS_DIR:-/home/comfyuser/workspace/models}",
        description = "Storage root (default: ${DEFAULT-VALUE})")
    private Path modelsDir;

    @CommandLine.Option(names = "--tmp-dir",
        defaultValue = "${env:DOWNLOADS_TMP:-/home/comfyuser/workspace/downloads_tmp}",
        description = "Staging directory for partial downloads (default: ${DEFAULT-VALUE})")
    private Path tmpDir;

    @CommandLine.Option(names = "--max-concurrent", defaultValue = "${env:MAX_CONCURRENT_DOWNLOADS:-2}",
        description = "Artifacts downloaded at the same time (default: ${DEFAULT-VALUE})")
    private int maxConcurrent;

    @CommandLine.Option(names = "--connections", defaultValue = "${env:DOWNLOAD_CONNECTIONS:-4}",
        description = "Segments in flight per file (default: ${DEFAULT-VALUE})")
    private int connections;

    @CommandLine.Option(names = "--segment-size", defaultValue = "${env:DOWNLOAD_SEGMENT_SIZE:-67108864}",
        description = "Segment size in bytes (default: ${DEFAULT-VALUE})")
    private long segmentSize;

    @CommandLine.Option(names = "--max-attempts", defaultValue = "${env:DOWNLOAD_MAX_ATTEMPTS:-3}",
        description = "Attempts per request or segment on transient failures (default: ${DEFAULT-VALUE})")
    private int maxAttempts;

    @CommandLine.Option(names = "--marker-policy", defaultValue = "${env:MARKER_POLICY:-TOLERATE_PARTIAL}",
        description = "When to record completion: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private MarkerPolicy markerPolicy;

    @CommandLine.Option(names = "--unknown-type-policy", defaultValue = "${env:UNKNOWN_TYPE_POLICY:-ROUTE_TO_OTHER}",
        description = "Unrecognized marketplace types: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    private UnknownTypePolicy unknownTypePolicy;

    @CommandLine.Option(names = "--hf-revision", defaultValue = "${env:HF_REVISION:-main}",
        description = "Hub revision used when a repository names none (default: ${DEFAULT-VALUE})")
    private String hubRevision;

    @CommandLine.Option(names = "--civitai-base-url", defaultValue = "${env:CIVITAI_BASE_URL:-https://civitai.com}",
        description = "Marketplace base URL (default: ${DEFAULT-VALUE})")
    private String civitaiBaseUrl;

    @CommandLine.Option(names = "--hf-base-url", defaultValue = "${env:HF_BASE_URL:-https://huggingface.co}",
        description = "Hub base URL (default: ${DEFAULT-VALUE})")
    private String hubBaseUrl;

    @CommandLine.Option(names = "--network-wait", defaultValue = "${env:NETWORK_WAIT_SECONDS:-60}",
        description = "Seconds to wait for the registries to become reachable (default: ${DEFAULT-VALUE})")
    private long networkWaitSeconds;

    @CommandLine.Option(names = "--debug", defaultValue = "${env:DEBUG_MODE:-false}",
        description = "Enable debug logging")
    private boolean debug;

    @CommandLine.Option(names = "--force", defaultValue = "${env:FORCE_DOWNLOAD:-false}",
        description = "Ignore the completion marker")
    private boolean force;

    private Function<String, String> environment = System::getenv;
    private Path userHome = Path.of(System.getProperty("user.home"));

    /// Run modelfetch directly
    public static void main(String[] args) {
        int exitCode = new CommandLine(new CMD_modelfetch()).execute(args);
        System.exit(exitCode);
    }

    public CMD_modelfetch() {
    }

    CMD_modelfetch(Function<String, String> environment, Path userHome) {
        this.environment = environment;
        this.userHome = userHome;
    }

    @Override
    public Integer call() {
        if (debug) {
            Configurator.setLevel("io.catalyst.modelfetch", Level.DEBUG);
        }
        PipelineSettings settings;
        try {
            settings = settings();
        } catch (IllegalArgumentException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            return EXIT_SETUP_ERROR;
        }
        try (PipelineOrchestrator orchestrator = new PipelineOrchestrator(settings)) {
            RunReport report = orchestrator.run();
            return report.status().exitCode();
        } catch (UncheckedIOException e) {
            logger.error("Cannot prepare directories: {}", e.getMessage());
            return EXIT_SETUP_ERROR;
        }
    }

    PipelineSettings settings() {
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException("--timeout must be positive: " + timeoutSeconds);
        }
        TransportSettings transport = TransportSettings.builder()
            .connections(connections)
            .segmentSize(segmentSize)
            .retryPolicy(RetryPolicy.of(maxAttempts))
            .build();
        return PipelineSettings.builder()
            .identifiers(IdentifierList.CHECKPOINTS, checkpoints)
            .identifiers(IdentifierList.LORAS, loras)
            .identifiers(IdentifierList.VAES, vaes)
            .identifiers(IdentifierList.EMBEDDINGS, embeddings)
            .identifiers(IdentifierList.CONTROLNETS, controlnets)
            .identifiers(IdentifierList.UPSCALERS, upscalers)
            .identifiers(IdentifierList.MODELS, models)
            .identifiers(IdentifierList.HUB_REPOSITORIES, hubRepositories)
            .storageRoot(expandHome(modelsDir))
            .tempDir(expandHome(tmpDir))
            .timeout(Duration.ofSeconds(timeoutSeconds))
            .networkWait(Duration.ofSeconds(networkWaitSeconds))
            .maxConcurrent(maxConcurrent)
            .force(force)
            .markerPolicy(markerPolicy)
            .unknownTypePolicy(unknownTypePolicy)
            .marketplaceBaseUrl(civitaiBaseUrl)
            .marketplaceToken(blankToNull(civitaiToken))
            .hubBaseUrl(hubBaseUrl)
            .hubToken(hubToken())
            .hubRevision(hubRevision)
            .transport(transport)
            .build();
    }

    /// The hub token from the option, then `HF_TOKEN`, then the hub CLI's token file.
    String hubToken() {
        String token = blankToNull(hubToken);
        if (token == null) {
            token = blankToNull(environment.apply("HF_TOKEN"));
        }
        if (token == null) {
            Path tokenFile = userHome.resolve(".cache").resolve("huggingface").resolve("token");
            if (Files.isRegularFile(tokenFile)) {
                try {
                    token = blankToNull(Files.readString(tokenFile));
                    logger.debug("Hub token read from {}", tokenFile);
                } catch (IOException e) {
                    logger.warn("Cannot read hub token file {}: {}", tokenFile, e.getMessage());
                }
            }
        }
        return token;
    }

    private Path expandHome(Path path) {
        String text = path.toString();
        if (text.equals("~") || text.startsWith("~/")) {
            return userHome.resolve(text.substring(1).replaceFirst("^/", ""));
        }
        return path;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
