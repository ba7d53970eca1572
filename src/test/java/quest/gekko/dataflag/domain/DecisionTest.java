package quest.gekko.dataflag.domain;

import org.junit.jupiter.api.Test;
import quest.gekko.dataflag.exception.ValidationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DecisionTest {

    @Test
    void parsesStoredValues() {
        assertThat(Decision.fromValue("good")).isEqualTo(Decision.GOOD);
        assertThat(Decision.fromValue("bad")).isEqualTo(Decision.BAD);
        assertThat(Decision.fromValue("unsure")).isEqualTo(Decision.UNSURE);
        assertThat(Decision.names()).containsExactly("good", "bad", "unsure");
    }

    @Test
    void rejectsUnknownValuesListingTheChoices() {
        assertThatThrownBy(() -> Decision.fromValue("BAD"))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Invalid value 'BAD' for 'decision'. Choose one of [good, bad, unsure]");
        assertThatThrownBy(() -> Decision.fromValue(null)).isInstanceOf(ValidationException.class);
    }

    @Test
    void userNamesStartUpperCase() {
        assertThat(DataFlagUser.normalize("alice")).isEqualTo("Alice");
        assertThat(DataFlagUser.normalize(" Bob ")).isEqualTo("Bob");
        assertThat(DataFlagUser.normalize("")).isEmpty();
    }

    @Test
    void opinionEditTimeNeverMovesBackwards() {
        DataFlagOpinion opinion = new DataFlagOpinion();
        opinion.setCreationTime(100);
        opinion.setLastEdit(100);

        opinion.touch(50);
        assertThat(opinion.getLastEdit()).isEqualTo(100);

        opinion.touch(150);
        assertThat(opinion.getLastEdit()).isEqualTo(150);
    }
}
