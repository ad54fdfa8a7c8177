package com.blueprintarchitect.core.validation.impl;

import com.blueprintarchitect.core.model.Component;
import com.blueprintarchitect.core.model.ComponentType;
import com.blueprintarchitect.core.model.IssueSeverity;
import com.blueprintarchitect.core.validation.ValidationIssue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.blueprintarchitect.core.BlueprintFixtures.blueprint;
import static com.blueprintarchitect.core.BlueprintFixtures.context;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link CompletenessCheck}.
 */
class CompletenessCheckTest {

    private final CompletenessCheck check = new CompletenessCheck();

    @Test
    void check_apiAndPersistMentionedWithoutComponents_reportsBoth() {
        List<ValidationIssue> issues = check.check(context(blueprint(
            "A REST service that persists orders",
            List.of(Component.of("src", ComponentType.SOURCE)), List.of())));

        assertThat(issues).extracting(ValidationIssue::code, ValidationIssue::severity).containsExactly(
            tuple(CompletenessCheck.MISSING_API_COMPONENT, IssueSeverity.ERROR),
            tuple(CompletenessCheck.MISSING_STORE_COMPONENT, IssueSeverity.WARNING));
    }

    @Test
    void check_keywordsInsideOtherWords_areIgnored() {
        List<ValidationIssue> issues = check.check(context(blueprint(
            "Rapid therapist restock forecasting",
            List.of(Component.of("src", ComponentType.SOURCE)), List.of())));

        assertThat(issues).isEmpty();
    }

    @Test
    void check_componentDescriptionsAreScanned() {
        Component src = new Component("src", ComponentType.SOURCE, "Saves clicks for later", null, null,
            false, false, null);

        assertThat(check.check(context(blueprint(List.of(src), List.of()))))
            .extracting(ValidationIssue::code)
            .containsExactly(CompletenessCheck.MISSING_STORE_COMPONENT);
    }

    @Test
    void check_expectedComponentsPresent_isClean() {
        assertThat(check.check(context(blueprint(
            "Public API that stores orders",
            List.of(Component.of("api", ComponentType.API_ENDPOINT), Component.of("db", ComponentType.STORE)),
            List.of())))).isEmpty();
    }
}
