package io.harmonia.core.context;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ExecutionContextTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private ExecutionContext context;

    @BeforeEach
    void setUp() {
        context =
                ExecutionContext.builder()
                        .runId("run-1")
                        .pipelineName("harmonize")
                        .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                        .parameters(Map.of("species", "human"))
                        .build();
    }

    @Nested
    class Statistics {

        @Test
        void shouldMergeNestedMapsRecursively() {
            context.mergeStatistics("mapping", Map.of("genes", Map.of("mapped", 10)));
            context.mergeStatistics("mapping", Map.of("genes", Map.of("unmapped", 2), "runs", 1));

            assertThat(context.getStatistic("mapping"))
                    .contains(Map.of("genes", Map.of("mapped", 10, "unmapped", 2), "runs", 1));
        }

        @Test
        void shouldAppendListsAndReplaceScalars() {
            context.mergeStatistics("sources", List.of("hgnc"));
            context.mergeStatistics("sources", List.of("ensembl"));
            context.mergeStatistics("count", 1);
            context.mergeStatistics("count", 5);

            assertThat(context.getStatistics())
                    .containsEntry("sources", List.of("hgnc", "ensembl"))
                    .containsEntry("count", 5);
        }

        @Test
        void shouldReplaceWhenShapesDiffer() {
            context.mergeStatistics("x", Map.of("a", 1));
            context.mergeStatistics("x", List.of(1));

            assertThat(context.getStatistic("x")).contains(List.of(1));
        }

        @Test
        void shouldNotAliasCallerCollections() {
            Map<String, Object> mine = new LinkedHashMap<>();
            List<Object> ids = new ArrayList<>(List.of("a"));
            mine.put("ids", ids);
            context.mergeStatistics("k", mine);

            ids.add("b");
            mine.put("extra", true);

            assertThat(context.getStatistic("k")).contains(Map.of("ids", List.of("a")));
        }

        @Test
        void shouldAbsorbStatisticsFromChild() {
            context.mergeStatistics("rows", Map.of("in", 3));
            ExecutionContext child = context.isolated(Map.of());
            child.mergeStatistics("rows", Map.of("out", 2));

            context.absorbStatistics(child);

            assertThat(context.getStatistic("rows")).contains(Map.of("in", 3, "out", 2));
        }
    }

    @Nested
    class Isolation {

        @Test
        void shouldShareRunInformationButNotSlots() {
            Dataset piece = Dataset.fromRows(List.of(Map.of("id", "A")));
            context.putDataset("all", piece);
            context.setDeadline(NOW.plusSeconds(5));
            context.mergeStatistics("parent_only", 1);

            ExecutionContext child = context.isolated(Map.of("piece", piece));
            child.putDataset("out", piece);
            child.recordStep("child", "done");

            assertThat(child.getRunId()).isEqualTo("run-1");
            assertThat(child.getParameters()).containsEntry("species", "human");
            assertThat(child.getDeadline()).contains(NOW.plusSeconds(5));
            assertThat(child.getDatasets()).containsOnlyKeys("piece", "out");
            assertThat(child.getStatistics()).isEmpty();
            assertThat(context.hasDataset("out")).isFalse();
            assertThat(context.getProvenance()).isEmpty();
        }

        @Test
        void shouldKeepWorkingCopyWritesUntilAdopted() {
            Dataset rows = Dataset.fromRows(List.of(Map.of("id", "A")));
            context.putDataset("in", rows);
            context.mergeStatistics("load", Map.of("rows", 1));
            context.recordStep("load", "done");

            ExecutionContext copy = context.workingCopy();
            copy.putDataset("out", rows);
            copy.mergeStatistics("load", Map.of("skipped", 0));
            copy.recordStep("map", "done");
            copy.putOutputFile("report", Path.of("/out/report.csv"));

            assertThat(copy.getDatasets()).containsOnlyKeys("in", "out");
            assertThat(context.getDatasets()).containsOnlyKeys("in");
            assertThat(context.getStatistic("load")).contains(Map.of("rows", 1));
            assertThat(context.getProvenance()).hasSize(1);
            assertThat(context.getOutputFiles()).isEmpty();

            context.adopt(copy);

            assertThat(context.getDatasets()).containsOnlyKeys("in", "out");
            assertThat(context.getStatistic("load")).contains(Map.of("rows", 1, "skipped", 0));
            assertThat(context.getProvenance())
                    .extracting(ProvenanceRecord::source)
                    .containsExactly("load", "map");
            assertThat(context.getOutputFiles()).containsKey("report");
        }
    }

    @Nested
    class Provenance {

        @Test
        void shouldAppendInOrderWithClockTimestamps() {
            context.recordStep("load", "completed");
            context.recordWarning("map", "3 unmapped");

            assertThat(context.getProvenance())
                    .containsExactly(
                            new ProvenanceRecord("load", NOW, ProvenanceType.STEP, "completed"),
                            new ProvenanceRecord("map", NOW, ProvenanceType.WARNING, "3 unmapped"));
            assertThat(context.getProvenance().get(1).isWarning()).isTrue();
        }
    }

    @Test
    void shouldOverwriteDatasetsAndTrackOutputFiles() {
        Dataset first = Dataset.fromRows(List.of(Map.of("id", "A")));
        Dataset second = Dataset.fromRows(List.of(Map.of("id", "B")));
        context.putDataset("genes", first);
        context.putDataset("genes", second);
        context.putOutputFile("report", Path.of("/out/report.csv"));

        assertThat(context.getDataset("genes")).contains(second);
        assertThat(context.getDataset("missing")).isEmpty();
        assertThat(context.getOutputFiles()).containsEntry("report", Path.of("/out/report.csv"));
    }

    @Test
    void shouldGenerateRunIdWhenAbsent() {
        ExecutionContext anonymous = ExecutionContext.builder().pipelineName("p").build();

        assertThat(anonymous.getRunId()).isNotBlank();
        assertThat(anonymous.getDeadline()).isEmpty();
    }
}
