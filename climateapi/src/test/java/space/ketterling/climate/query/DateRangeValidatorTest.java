package space.ketterling.climate.query;

import org.junit.jupiter.api.Test;
import space.ketterling.climate.model.DateRange;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class DateRangeValidatorTest {
    private final DateRangeValidator validator = new DateRangeValidator();

    @Test
    void openRangeKeepsStartOnly() {
        DateRange r = validator.validate("2016-08-23");

        assertThat(r.start()).isEqualTo("2016-08-23");
        assertThat(r.end()).isNull();
        assertThat(r.isOpen()).isTrue();
    }

    @Test
    void ascendingRangeIsUnchanged() {
        DateRange r = validator.validate("2010-01-01", "2010-01-03");

        assertThat(r.start()).isEqualTo("2010-01-01");
        assertThat(r.end()).isEqualTo("2010-01-03");
    }

    @Test
    void reversedRangeIsSwapped() {
        DateRange r = validator.validate("2010-01-03", "2010-01-01");

        assertThat(r.start()).isEqualTo("2010-01-01");
        assertThat(r.end()).isEqualTo("2010-01-03");
    }

    @Test
    void trailingCharactersAfterDatePrefixAreTolerated() {
        DateRange r = validator.validate("2017-01-01T00:00", "2017-02-01abc");

        assertThat(r.start()).isEqualTo("2017-01-01T00:00");
        assertThat(r.end()).isEqualTo("2017-02-01abc");
    }

    @Test
    void prefixOnlyChecksShapeNotCalendar() {
        assertThat(validator.validate("2017-13-45").start()).isEqualTo("2017-13-45");
    }

    @Test
    void malformedStartIsRejectedWithItsValueAndFormat() {
        assertThatThrownBy(() -> validator.validate("08-23-2016"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("'08-23-2016'")
                .hasMessageContaining("yyyy-mm-dd");
    }

    @Test
    void prefixMustBeAtStartOfString() {
        assertThatThrownBy(() -> validator.validate(" 2016-08-23"))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> validator.validate("x2016-08-23"))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void shortAndNullInputsAreRejected() {
        assertThatThrownBy(() -> validator.validate("2016-8-23")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> validator.validate("")).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> validator.validate(null)).isInstanceOf(ValidationException.class);
    }

    @Test
    void badEndIsReportedAsEnd() {
        ValidationException e = catchThrowableOfType(
                () -> validator.validate("2016-08-23", "tomorrow"), ValidationException.class);

        assertThat(e.invalidFields()).containsExactly("end");
        assertThat(e.getMessage())
                .contains("'2016-08-23'")
                .contains("'tomorrow'")
                .contains("yyyy-mm-dd");
    }

    @Test
    void bothBadAreReportedTogether() {
        ValidationException e = catchThrowableOfType(
                () -> validator.validate("yesterday", "tomorrow"), ValidationException.class);

        assertThat(e.invalidFields()).containsExactly("start", "end");
    }

    @Test
    void badStartOfClosedRangeIsReportedAsStart() {
        ValidationException e = catchThrowableOfType(
                () -> validator.validate("2016/08/23", "2017-08-23"), ValidationException.class);

        assertThat(e.invalidFields()).containsExactly("start");
        assertThat(e.getMessage()).contains("'2016/08/23'").contains("'2017-08-23'");
    }
}
