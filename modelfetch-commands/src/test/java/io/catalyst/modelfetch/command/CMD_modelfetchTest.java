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
import io.catalyst.modelfetch.pipeline.PipelineSettings;
import io.catalyst.modelfetch.registry.UnknownTypePolicy;
import io.catalyst.modelfetch.testserver.Handlers;
import io.catalyst.modelfetch.testserver.TestWebServerFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CMD_modelfetchTest {

    private static final String COMMIT = "89abcdef0123456789abcdef0123456789abcdef";
    private static final byte[] CONFIG = "{\"hidden_size\": 768}\n".getBytes(StandardCharsets.UTF_8);

    @TempDir
    Path root;

    private TestWebServerFixture hub;

    @BeforeEach
    void setUp() throws IOException {
        hub = new TestWebServerFixture();
        hub.start();
        hub.route("/api/models/org/tiny/revision/main", Handlers.json(200, """
            {"id": "org/tiny", "sha": "%s",
             "siblings": [{"rfilename": "config.json", "size": %d, "blobId": "%s"}]}
            """.formatted(COMMIT, CONFIG.length, gitBlobSha1(CONFIG))));
        hub.route("/org/tiny/resolve/" + COMMIT + "/config.json", Handlers.bytes(CONFIG));
    }

    @AfterEach
    void tearDown() {
        hub.close();
    }

    @Test
    void downloadsHubRepositoryAndSkipsTheRepeatRun() {
        assertThat(execute("--hf-repos", "org/tiny")).isZero();
        assertThat(root.resolve("models/hub_snapshot/org/tiny/config.json")).hasBinaryContent(CONFIG);
        assertThat(root.resolve("models/.modelfetch_complete")).exists();

        hub.clearRequests();
        assertThat(execute("--hf-repos", "org/tiny")).isZero();
        assertThat(hub.requests()).isEmpty();
    }

    @Test
    void missingRepositoryIsAHardFailure() {
        assertThat(execute("--hf-repos", "org/absent")).isEqualTo(1);
        assertThat(root.resolve("models/.modelfetch_complete")).doesNotExist();
    }

    @Test
    void nothingConfiguredSucceeds() {
        assertThat(execute()).isZero();
        assertThat(hub.requests()).isEmpty();
    }

    @Test
    void invalidNumbersAreSetupErrors() {
        assertThat(execute("--hf-repos", "org/tiny", "--max-concurrent", "0")).isEqualTo(3);
        assertThat(execute("--hf-repos", "org/tiny", "--timeout", "0")).isEqualTo(3);
        assertThat(hub.requests()).isEmpty();
    }

    @Test
    void baseUrlWithoutSchemeIsASetupError() {
        assertThat(executeWithBaseUrls("civitai.com", hub.baseUrl(), "--checkpoints", "1")).isEqualTo(3);
        assertThat(executeWithBaseUrls(hub.baseUrl(), "ftp://huggingface.co", "--hf-repos", "org/tiny")).isEqualTo(3);
        assertThat(hub.requests()).isEmpty();
        assertThat(root.resolve("models")).doesNotExist();
    }

    @Test
    void unusableModelsDirectoryIsASetupError() throws IOException {
        Files.writeString(root.resolve("blocker"), "file");
        int exit = new CommandLine(new CMD_modelfetch(name -> null, root)).execute(
            "--hf-repos", "org/tiny",
            "--models-dir", root.resolve("blocker/models").toString(),
            "--tmp-dir", root.resolve("tmp").toString(),
            "--hf-base-url", hub.baseUrl(),
            "--network-wait", "0");
        assertThat(exit).isEqualTo(3);
    }

    @Test
    void optionsAreFoldedIntoSettings() {
        CMD_modelfetch command = new CMD_modelfetch(name -> null, root);
        new CommandLine(command).parseArgs(
            "--checkpoints", "1569593",
            "--models", "42@43",
            "--timeout", "90",
            "--models-dir", "~/models",
            "--tmp-dir", root.resolve("tmp").toString(),
            "--max-concurrent", "3",
            "--connections", "8",
            "--segment-size", "1048576",
            "--marker-policy", "SUCCESS_ONLY",
            "--unknown-type-policy", "REJECT",
            "--hf-revision", "v2",
            "--force");

        PipelineSettings settings = command.settings();

        assertThat(settings.identifiers()).containsEntry(IdentifierList.CHECKPOINTS, "1569593")
            .containsEntry(IdentifierList.MODELS, "42@43");
        assertThat(settings.timeout()).isEqualTo(Duration.ofSeconds(90));
        assertThat(settings.storageRoot()).isEqualTo(root.resolve("models"));
        assertThat(settings.maxConcurrent()).isEqualTo(3);
        assertThat(settings.transport().connections()).isEqualTo(8);
        assertThat(settings.transport().segmentSize()).isEqualTo(1048576L);
        assertThat(settings.markerPolicy()).isEqualTo(MarkerPolicy.SUCCESS_ONLY);
        assertThat(settings.unknownTypePolicy()).isEqualTo(UnknownTypePolicy.REJECT);
        assertThat(settings.hubRevision()).isEqualTo("v2");
        assertThat(settings.force()).isTrue();
    }

    @Test
    void hubTokenFallsBackToEnvironmentThenTokenFile() throws IOException {
        Map<String, String> env = Map.of("HF_TOKEN", " env-token ");

        CMD_modelfetch fromOption = new CMD_modelfetch(env::get, root);
        new CommandLine(fromOption).parseArgs("--hf-token", "option-token");
        assertThat(fromOption.hubToken()).isEqualTo("option-token");

        CMD_modelfetch fromEnv = new CMD_modelfetch(env::get, root);
        new CommandLine(fromEnv).parseArgs("--hf-token", "");
        assertThat(fromEnv.hubToken()).isEqualTo("env-token");

        Path tokenFile = root.resolve(".cache/huggingface/token");
        Files.createDirectories(tokenFile.getParent());
        Files.writeString(tokenFile, "file-token\n");
        CMD_modelfetch fromFile = new CMD_modelfetch(name -> null, root);
        new CommandLine(fromFile).parseArgs("--hf-token", "");
        assertThat(fromFile.hubToken()).isEqualTo("file-token");
    }

    private int execute(String... options) {
        return executeWithBaseUrls(hub.baseUrl(), hub.baseUrl(), options);
    }

    private int executeWithBaseUrls(String civitaiBaseUrl, String hubBaseUrl, String... options) {
        List<String> args = new ArrayList<>(List.of(
            "--models-dir", root.resolve("models").toString(),
            "--tmp-dir", root.resolve("tmp").toString(),
            "--hf-base-url", hubBaseUrl,
            "--civitai-base-url", civitaiBaseUrl,
            "--network-wait", "0",
            "--max-attempts", "1"));
        args.addAll(List.of(options));
        return new CommandLine(new CMD_modelfetch(name -> null, root)).execute(args.toArray(new String[0]));
    }

    private static String gitBlobSha1(byte[] data) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-1");
            digest.update(("blob " + data.length + "\0").getBytes(StandardCharsets.US_ASCII));
            return HexFormat.of().formatHex(digest.digest(data));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
