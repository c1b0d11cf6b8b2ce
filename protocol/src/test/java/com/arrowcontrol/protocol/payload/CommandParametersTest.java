package com.arrowcontrol.protocol.payload;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

class CommandParametersTest {

    @Test
    void defaultsToSingleInstantTap() {
        CommandParameters parameters = CommandParameters.of("right");

        assertThat(parameters.repeat()).isEqualTo(1);
        assertThat(parameters.holdTime()).isZero();
    }

    @Test
    void keepsExplicitValues() {
        CommandParameters parameters = new CommandParameters("left", 3, 250);

        assertThat(parameters.repeat()).isEqualTo(3);
        assertThat(parameters.holdTime()).isEqualTo(250);
    }

    @Test
    void rejectsNonPositiveRepeat() {
        assertThatIllegalArgumentException().isThrownBy(() -> new CommandParameters("left", 0, 0));
        assertThatIllegalArgumentException().isThrownBy(() -> new CommandParameters("left", -2, 0));
    }

    @Test
    void rejectsNegativeHoldTime() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new CommandParameters("left", 1, -1))
                .withMessageContaining("holdTime");
    }
}
