package io.metalcontroller.models;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SystemInformationTest {

    private final SystemInformation reported = SystemInformation.builder()
            .manufacturer("Dell Inc.")
            .productName("PowerEdge R640")
            .version("1.0")
            .serialNumber("ABC123")
            .skuNumber("SKU=0716")
            .family("PowerEdge")
            .build();

    @Test
    void testPartialEqual_OnlyManufacturer() {
        assertThat(SystemInformation.builder().manufacturer("Dell Inc.").build().partialEqual(reported)).isTrue();
    }

    @Test
    void testPartialEqual_ManufacturerAndProduct() {
        SystemInformation qualifier = SystemInformation.builder()
                .manufacturer("Dell Inc.")
                .productName("PowerEdge R640")
                .build();
        assertThat(qualifier.partialEqual(reported)).isTrue();
    }

    @Test
    void testPartialEqual_EverySetFieldMustMatch() {
        SystemInformation qualifier = SystemInformation.builder()
                .manufacturer("Dell Inc.")
                .productName("PowerEdge R740")
                .build();
        assertThat(qualifier.partialEqual(reported)).isFalse();
        assertThat(SystemInformation.builder().serialNumber("XYZ").build().partialEqual(reported)).isFalse();
        assertThat(SystemInformation.builder().family("ProLiant").build().partialEqual(reported)).isFalse();
    }

    @Test
    void testPartialEqual_EmptyQualifierMatchesAnyReportedDescriptor() {
        assertThat(new SystemInformation().partialEqual(reported)).isTrue();
        assertThat(new SystemInformation().partialEqual(null)).isFalse();
    }
}
