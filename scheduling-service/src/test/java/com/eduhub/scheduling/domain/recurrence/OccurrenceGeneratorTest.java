package com.eduhub.scheduling.domain.recurrence;

import com.eduhub.common.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OccurrenceGeneratorTest {

    private static final ZoneId EDMONTON = ZoneId.of("America/Edmonton");
    private static final Term SPRING_TERM = new Term(LocalDate.of(2026, 2, 9), LocalDate.of(2026, 6, 13), EDMONTON);
    private static final RecurrenceRule TUESDAY_EVENING = RecurrenceRule.of(2, "18:30", 60);

    private final OccurrenceGenerator generator = new OccurrenceGenerator();

    @Test
    @DisplayName("Local start time is kept across the March DST change while the UTC instant moves")
    void generate_acrossDstChange_keepsLocalWallClock() {
        // when
        List<Occurrence> occurrences = generator.generate(SPRING_TERM, TUESDAY_EVENING, ExclusionSet.none());

        // then
        assertThat(occurrences).hasSize(18);
        assertThat(occurrences).allSatisfy(occurrence -> {
            assertThat(occurrence.localDate().getDayOfWeek()).isEqualTo(DayOfWeek.TUESDAY);
            assertThat(occurrence.startAtUtc().atZone(EDMONTON).toLocalTime()).isEqualTo(LocalTime.of(18, 30));
            assertThat(occurrence.endAtUtc().atZone(EDMONTON).toLocalTime()).isEqualTo(LocalTime.of(19, 30));
        });

        // MST (UTC-7) before March 8, MDT (UTC-6) after
        assertThat(occurrences.get(0).localDate()).isEqualTo(LocalDate.of(2026, 2, 10));
        assertThat(occurrences.get(0).startAtUtc()).isEqualTo(Instant.parse("2026-02-11T01:30:00Z"));
        assertThat(occurrences.get(3).localDate()).isEqualTo(LocalDate.of(2026, 3, 3));
        assertThat(occurrences.get(3).startAtUtc()).isEqualTo(Instant.parse("2026-03-04T01:30:00Z"));
        assertThat(occurrences.get(4).localDate()).isEqualTo(LocalDate.of(2026, 3, 10));
        assertThat(occurrences.get(4).startAtUtc()).isEqualTo(Instant.parse("2026-03-11T00:30:00Z"));
        assertThat(occurrences.get(17).localDate()).isEqualTo(LocalDate.of(2026, 6, 9));
    }

    @Test
    @DisplayName("Occurrences are sorted by start and fall inside the term window")
    void generate_returnsSortedOccurrencesInsideTerm() {
        List<Occurrence> occurrences = generator.generate(SPRING_TERM, TUESDAY_EVENING, ExclusionSet.none());
        BookingWindow window = SPRING_TERM.toUtcWindow();

        assertThat(occurrences).isSortedAccordingTo((a, b) -> a.startAtUtc().compareTo(b.startAtUtc()));
        assertThat(occurrences).allMatch(occurrence -> window.contains(occurrence.startAtUtc()));
    }

    @Test
    @DisplayName("Excluded dates produce no occurrence")
    void generate_withExclusions_skipsExcludedDates() {
        ExclusionSet exclusions = ExclusionSet.parse(List.of("# spring break", "2026-03-17", "", "2026-03-24"));

        List<Occurrence> occurrences = generator.generate(SPRING_TERM, TUESDAY_EVENING, exclusions);

        assertThat(occurrences).hasSize(16);
        assertThat(occurrences).extracting(Occurrence::localDate)
                .doesNotContain(LocalDate.of(2026, 3, 17), LocalDate.of(2026, 3, 24));
    }

    @Test
    @DisplayName("Same input always yields the same output")
    void generate_isDeterministic() {
        assertThat(generator.generate(SPRING_TERM, TUESDAY_EVENING, ExclusionSet.none()))
                .isEqualTo(generator.generate(SPRING_TERM, TUESDAY_EVENING, ExclusionSet.none()));
    }

    @Test
    @DisplayName("A term spanning N weeks yields exactly N occurrences")
    void generate_termSpanningWeeks_yieldsOnePerWeek() {
        Term term = Term.spanningWeeks(LocalDate.of(2026, 2, 9), 12, EDMONTON);

        assertThat(generator.generate(term, RecurrenceRule.of(4, "16:00", 45), ExclusionSet.none())).hasSize(12);
    }

    @Test
    @DisplayName("A term without the rule's weekday yields nothing")
    void generate_weekdayNotInTerm_returnsEmpty() {
        Term monday = new Term(LocalDate.of(2026, 2, 9), LocalDate.of(2026, 2, 9), EDMONTON);

        assertThat(generator.generate(monday, TUESDAY_EVENING, ExclusionSet.none())).isEmpty();
    }

    @Test
    @DisplayName("A start inside the spring-forward gap moves forward by the gap")
    void generate_startInDstGap_shiftsForward() {
        Term dstSunday = new Term(LocalDate.of(2026, 3, 8), LocalDate.of(2026, 3, 8), EDMONTON);

        List<Occurrence> occurrences = generator.generate(dstSunday, RecurrenceRule.of(7, "02:30", 30), ExclusionSet.none());

        assertThat(occurrences).hasSize(1);
        Occurrence occurrence = occurrences.get(0);
        assertThat(occurrence.localDate()).isEqualTo(LocalDate.of(2026, 3, 8));
        assertThat(occurrence.startAtUtc().atZone(EDMONTON).toLocalTime()).isEqualTo(LocalTime.of(3, 30));
        assertThat(occurrence.endAtUtc()).isAfter(occurrence.startAtUtc());
    }

    @Test
    @DisplayName("A rule crossing local midnight is rejected")
    void generate_crossingMidnight_throwsValidation() {
        RecurrenceRule lateNight = RecurrenceRule.of(5, "23:30", 60);

        assertThatThrownBy(() -> generator.generate(SPRING_TERM, lateNight, ExclusionSet.none()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("crosses midnight");
    }

    @Test
    @DisplayName("Invalid term and rule input is rejected before generation")
    void invalidInput_throwsValidation() {
        assertThatThrownBy(() -> Term.of("2026-06-13", "2026-02-09", "America/Edmonton"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> Term.of("2026-02-09", "2026-06-13", "Mars/Olympus"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> Term.of("2026-02-30", "2026-06-13", "America/Edmonton"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> RecurrenceRule.of(2, "18:30", 0))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> RecurrenceRule.of(8, "18:30", 60))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> RecurrenceRule.of(2, "6:30 PM", 60))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> generator.generate(null, TUESDAY_EVENING, ExclusionSet.none()))
                .isInstanceOf(ValidationException.class);
    }
}
