package com.krishnamouli.cohort.catalog;

import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.krishnamouli.cohort.experiment.ConversionGoal;
import com.krishnamouli.cohort.experiment.Experiment;
import com.krishnamouli.cohort.experiment.ExperimentStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExperimentLoaderTest {

    private final ExperimentLoader loader = new ExperimentLoader();

    @Test
    void testBundledExperiments() {
        List<Experiment> experiments = loader.fromResource(ExperimentLoader.DEFAULT_RESOURCE);

        assertEquals(7, experiments.size());

        Experiment login = experiments.get(0);
        assertEquals("login_form_test", login.getId());
        assertEquals(ExperimentStatus.ACTIVE, login.getStatus());
        assertEquals(Instant.parse("2024-01-01T00:00:00Z"), login.getStartDate());
        assertEquals(100, login.totalAllocation());
        assertEquals("Sign In", login.findVariant("control").get().getConfig().get("buttonText").asText());
        assertTrue(login.findVariant("variant_b").get().getConfig().get("showSocialLogin").isBoolean());
        assertEquals(ConversionGoal.Type.FORM_SUBMIT, login.findGoal("login_success").get().getType());

        Experiment beta = experiments.stream()
                .filter(e -> e.getId().equals("feature_flags_test")).findFirst().get();
        assertEquals(50, beta.getTargetAudience().getPercentage());
        assertTrue(beta.getTargetAudience().getUserTypes().contains("lecturer"));

        Experiment buttons = experiments.get(6);
        assertEquals(ExperimentStatus.DRAFT, buttons.getStatus());
        assertNull(buttons.getStartDate());
    }

    @Test
    void testFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("experiments.json");
        Files.writeString(file, "[{\"id\":\"exp\",\"status\":\"paused\","
                + "\"variants\":[{\"id\":\"A\",\"allocation\":100}],"
                + "\"targetAudience\":{\"locations\":[\"ke\"]}}]");

        List<Experiment> experiments = loader.fromFile(file);

        assertEquals(1, experiments.size());
        assertEquals(ExperimentStatus.PAUSED, experiments.get(0).getStatus());
        assertEquals(100, experiments.get(0).getTargetAudience().getPercentage());
        assertTrue(experiments.get(0).getVariants().get(0).getConfig().isEmpty());
    }

    @Test
    void testDefaultsAndUnknownFields() {
        List<Experiment> experiments = loader.fromJson("[{\"id\":\"exp\",\"owner\":\"growth\"}]");

        assertEquals(ExperimentStatus.DRAFT, experiments.get(0).getStatus());
        assertEquals("exp", experiments.get(0).getName());
        assertTrue(experiments.get(0).getVariants().isEmpty());
    }

    @Test
    void testMalformedDefinitions() {
        assertThrows(UncheckedIOException.class, () -> loader.fromJson("{not json"));
        assertThrows(UncheckedIOException.class,
                () -> loader.fromJson("[{\"id\":\"exp\",\"variants\":[{\"id\":\"A\",\"allocation\":101}]}]"));
        assertThrows(UncheckedIOException.class, () -> loader.fromResource("missing.json"));
        assertThrows(UncheckedIOException.class, () -> loader.fromFile(Path.of("does/not/exist.json")));
    }

    @Test
    void testFractionalAllocationIsRejected() {
        UncheckedIOException e = assertThrows(UncheckedIOException.class, () -> loader.fromJson(
                "[{\"id\":\"exp\",\"variants\":[{\"id\":\"A\",\"allocation\":33.5},"
                        + "{\"id\":\"B\",\"allocation\":66.5}]}]"));
        assertInstanceOf(MismatchedInputException.class, e.getCause());

        List<Experiment> whole = loader.fromJson(
                "[{\"id\":\"exp\",\"variants\":[{\"id\":\"A\",\"allocation\":33},"
                        + "{\"id\":\"B\",\"allocation\":67}]}]");
        assertEquals(100, whole.get(0).totalAllocation());
    }
}
