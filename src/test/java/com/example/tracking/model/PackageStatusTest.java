package com.example.tracking.model;

import com.example.tracking.service.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PackageStatusTest {

    @Test
    @DisplayName("Carrier codes parse leniently and fall back to unknown")
    void fromCodeIsLenient() {
        assertThat(PackageStatus.fromCode("in_transit")).isEqualTo(PackageStatus.IN_TRANSIT);
        assertThat(PackageStatus.fromCode("Out-For-Delivery")).isEqualTo(PackageStatus.OUT_FOR_DELIVERY);
        assertThat(PackageStatus.fromCode(" DELIVERED ")).isEqualTo(PackageStatus.DELIVERED);
        assertThat(PackageStatus.fromCode("lost_in_space")).isEqualTo(PackageStatus.UNKNOWN);
        assertThat(PackageStatus.fromCode(null)).isEqualTo(PackageStatus.UNKNOWN);
    }

    @Test
    @DisplayName("Filter codes parse strictly")
    void requireCodeIsStrict() {
        assertThat(PackageStatus.requireCode("pending")).isEqualTo(PackageStatus.PENDING);
        assertThatThrownBy(() -> PackageStatus.requireCode("lost_in_space"))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    @DisplayName("Only delivered and exception are terminal")
    void terminalStates() {
        assertThat(PackageStatus.DELIVERED.isTerminal()).isTrue();
        assertThat(PackageStatus.EXCEPTION.isTerminal()).isTrue();
        assertThat(PackageStatus.PENDING.isTerminal()).isFalse();
        assertThat(PackageStatus.UNKNOWN.isTerminal()).isFalse();
    }

    @Test
    @DisplayName("Terminal state is left only for another terminal state")
    void mergeWithGuardsTerminalStates() {
        assertThat(PackageStatus.DELIVERED.mergeWith(PackageStatus.IN_TRANSIT)).isEqualTo(PackageStatus.DELIVERED);
        assertThat(PackageStatus.DELIVERED.mergeWith(PackageStatus.UNKNOWN)).isEqualTo(PackageStatus.DELIVERED);
        assertThat(PackageStatus.DELIVERED.mergeWith(PackageStatus.EXCEPTION)).isEqualTo(PackageStatus.EXCEPTION);
        assertThat(PackageStatus.EXCEPTION.mergeWith(PackageStatus.DELIVERED)).isEqualTo(PackageStatus.DELIVERED);
        assertThat(PackageStatus.OUT_FOR_DELIVERY.mergeWith(PackageStatus.IN_TRANSIT)).isEqualTo(PackageStatus.IN_TRANSIT);
        assertThat(PackageStatus.PENDING.mergeWith(null)).isEqualTo(PackageStatus.PENDING);
    }
}
