package com.blueprintarchitect.core.validation.impl;

import com.blueprintarchitect.core.model.Binding;
import com.blueprintarchitect.core.model.Component;
import com.blueprintarchitect.core.model.ComponentType;
import com.blueprintarchitect.core.validation.IssueKind;
import com.blueprintarchitect.core.validation.ValidationIssue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.blueprintarchitect.core.BlueprintFixtures.bind;
import static com.blueprintarchitect.core.BlueprintFixtures.blueprint;
import static com.blueprintarchitect.core.BlueprintFixtures.context;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link AntiPatternCheck}.
 */
class AntiPatternCheckTest {

    private final AntiPatternCheck check = new AntiPatternCheck();

    @Test
    void check_storeFeedingSource_reportsOneErrorNamingBoth() {
        List<ValidationIssue> issues = check.check(context(blueprint(
            List.of(Component.of("db", ComponentType.STORE), Component.of("ingest", ComponentType.SOURCE)),
            List.of(bind("db", "ingest"), Binding.of("db", "changes", "ingest", "replay")))));

        assertThat(issues).singleElement().satisfies(issue -> {
            assertThat(issue.kind()).isEqualTo(IssueKind.ANTIPATTERN);
            assertThat(issue.code()).isEqualTo(AntiPatternCheck.ARCHITECTURAL_ANTIPATTERN);
            assertThat(issue.isError()).isTrue();
            assertThat(issue.binding()).isEqualTo("db -> ingest");
            assertThat(issue.message()).contains("'db'", "'ingest'");
        });
    }

    @Test
    void check_fanOutAboveLimit_warnsWithRouterSuggestion() {
        List<ValidationIssue> issues = check.check(context(blueprint(
            List.of(Component.of("src", ComponentType.SOURCE), Component.of("a", ComponentType.STORE),
                Component.of("b", ComponentType.STORE), Component.of("c", ComponentType.STORE),
                Component.of("d", ComponentType.SINK)),
            List.of(bind("src", "a"), bind("src", "b"), bind("src", "c"), bind("src", "d")))));

        assertThat(issues).singleElement().satisfies(issue -> {
            assertThat(issue.code()).isEqualTo(AntiPatternCheck.EXCESSIVE_FAN_OUT);
            assertThat(issue.isError()).isFalse();
            assertThat(issue.suggestion()).contains("Router");
        });
    }

    @Test
    void check_fanOutAtLimit_isClean() {
        assertThat(check.check(context(blueprint(
            List.of(Component.of("src", ComponentType.SOURCE), Component.of("a", ComponentType.STORE),
                Component.of("b", ComponentType.STORE), Component.of("c", ComponentType.STORE)),
            List.of(bind("src", "a"), bind("src", "b"), bind("src", "c")))))).isEmpty();
    }
}
