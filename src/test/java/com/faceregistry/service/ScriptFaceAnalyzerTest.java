package com.faceregistry.service;

import com.faceregistry.config.RegistryProperties;
import com.faceregistry.dto.FaceAnalysis;
import com.faceregistry.exception.FaceAnalysisException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ScriptFaceAnalyzer Tests")
class ScriptFaceAnalyzerTest {

    private RegistryProperties properties;
    private ScriptFaceAnalyzer analyzer;

    @BeforeEach
    void setUp() {
        properties = new RegistryProperties();
        analyzer = new ScriptFaceAnalyzer(properties, new ObjectMapper());
    }

    @Nested
    @DisplayName("report parsing")
    class Parsing {

        @Test
        void singleFaceReportCarriesEmbeddingAndAttributes() throws Exception {
            String json = "{\"faces_found\":1,\"embedding\":[0.5,-0.25,1.0],\"age\":31.6,"
                    + "\"dominant_gender\":\"Woman\",\"gender\":{\"Woman\":97.1,\"Man\":2.9},"
                    + "\"dominant_emotion\":\"happy\",\"emotion\":{\"happy\":88.0,\"sad\":12.0},"
                    + "\"dominant_race\":\"asian\",\"race\":{\"asian\":70.0,\"white\":30.0},"
                    + "\"region\":{\"x\":10}}";

            FaceAnalysis analysis = analyzer.parse(json);

            assertThat(analysis.getFacesFound()).isEqualTo(1);
            assertThat(analysis.getEmbedding()).containsExactly(0.5f, -0.25f, 1.0f);
            assertThat(analysis.getAttributes().getAge()).isEqualTo(32);
            assertThat(analysis.getAttributes().getDominantGender()).isEqualTo("Woman");
            assertThat(analysis.getAttributes().getGenderScores()).containsEntry("Man", 2.9);
            assertThat(analysis.getAttributes().getDominantEmotion()).isEqualTo("happy");
            assertThat(analysis.getAttributes().getDominantEthnicity()).isEqualTo("asian");
            assertThat(analysis.getAttributes().getEthnicityScores()).containsEntry("white", 30.0);
        }

        @Test
        void zeroAndSeveralFacesCarryNoEmbedding() throws Exception {
            assertThat(analyzer.parse("{\"faces_found\":0}").getFacesFound()).isZero();

            FaceAnalysis several = analyzer.parse("{\"faces_found\":2,\"embedding\":[1.0]}");
            assertThat(several.getFacesFound()).isEqualTo(2);
            assertThat(several.getEmbedding()).isNull();
        }

        @Test
        void reportedErrorBecomesAnalysisFailure() {
            assertThatThrownBy(() -> analyzer.parse("{\"error\":\"cannot identify image file\"}"))
                    .isInstanceOf(FaceAnalysisException.class)
                    .hasMessage("cannot identify image file");
        }

        @Test
        void malformedReportsAreAnalysisFailures() {
            assertThatThrownBy(() -> analyzer.parse("Traceback (most recent call last):"))
                    .isInstanceOf(FaceAnalysisException.class);
            assertThatThrownBy(() -> analyzer.parse("{\"embedding\":[1.0]}"))
                    .isInstanceOf(FaceAnalysisException.class)
                    .hasMessageContaining("face count");
            assertThatThrownBy(() -> analyzer.parse("{\"faces_found\":1}"))
                    .isInstanceOf(FaceAnalysisException.class)
                    .hasMessageContaining("no embedding");
            assertThatThrownBy(() -> analyzer.parse(""))
                    .isInstanceOf(FaceAnalysisException.class);
        }
    }

    @Nested
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("external process")
    class ExternalProcess {

        @TempDir
        Path workDir;

        @Test
        void runsScriptAndParsesItsLastLine() throws Exception {
            Path script = writeScript("echo 'loading model weights'\n"
                    + "echo '{\"faces_found\":1,\"embedding\":[0.1,0.2],\"dominant_gender\":\"Man\"}'\n");
            configure(script);

            FaceAnalysis analysis = analyzer.analyze(new byte[]{1, 2, 3});

            assertThat(analysis.getEmbedding()).containsExactly(0.1f, 0.2f);
            assertThat(analysis.getAttributes().getDominantGender()).isEqualTo("Man");
            assertThat(stagedFiles()).isZero();
        }

        @Test
        void nonZeroExitIsAnAnalysisFailure() throws Exception {
            configure(writeScript("echo 'decode failed'\nexit 3\n"));

            assertThatThrownBy(() -> analyzer.analyze(new byte[]{1}))
                    .isInstanceOf(FaceAnalysisException.class)
                    .hasMessageContaining("exited with code 3")
                    .hasMessageContaining("decode failed");
            assertThat(stagedFiles()).isZero();
        }

        @Test
        void slowScriptTimesOut() throws Exception {
            configure(writeScript("sleep 5\n"));
            properties.getAnalyzer().setTimeoutSeconds(1);

            assertThatThrownBy(() -> analyzer.analyze(new byte[]{1}))
                    .isInstanceOf(FaceAnalysisException.class)
                    .hasMessageContaining("timed out");
        }

        @Test
        void verboseScriptsSucceedUnderParallelLoad() throws Exception {
            // about 300 KB of start-up noise before the report
            configure(writeScript("yes 'I tensorflow: loading model weights from cache' | head -n 6000\n"
                    + "echo '{\"faces_found\":1,\"embedding\":[0.5,0.25]}'\n"));
            properties.getAnalyzer().setTimeoutSeconds(30);
            int requests = Runtime.getRuntime().availableProcessors() + 2;

            ExecutorService executor = Executors.newFixedThreadPool(requests);
            try {
                List<Future<FaceAnalysis>> results = new ArrayList<>();
                for (int i = 0; i < requests; i++) {
                    byte[] image = {(byte) i};
                    results.add(executor.submit(() -> analyzer.analyze(image)));
                }
                for (Future<FaceAnalysis> result : results) {
                    assertThat(result.get(60, TimeUnit.SECONDS).getEmbedding()).containsExactly(0.5f, 0.25f);
                }
            } finally {
                executor.shutdownNow();
            }
            assertThat(stagedFiles()).isZero();
        }

        private Path writeScript(String body) throws IOException {
            Path script = workDir.resolve("analyze.sh");
            Files.writeString(script, "#!/bin/sh\n" + body);
            return script;
        }

        private void configure(Path script) throws IOException {
            properties.getAnalyzer().setCommand("sh");
            properties.getAnalyzer().setScript(script.toString());
            properties.getUpload().setTempDirectory(Files.createDirectories(workDir.resolve("staged")).toString());
        }

        private long stagedFiles() throws IOException {
            try (Stream<Path> files = Files.list(workDir.resolve("staged"))) {
                return files.count();
            }
        }
    }
}
