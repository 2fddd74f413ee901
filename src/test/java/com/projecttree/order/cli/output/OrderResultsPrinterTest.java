package com.projecttree.order.cli.output;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for OrderResultsPrinter.
 */
class OrderResultsPrinterTest {

    @Test
    void testFormatOrder() {
        assertThat(OrderResultsPrinter.formatOrder(1)).isEqualTo("1");
        assertThat(OrderResultsPrinter.formatOrder(42)).isEqualTo("42");
        assertThat(OrderResultsPrinter.formatOrder(0)).isEqualTo("-");
        assertThat(OrderResultsPrinter.formatOrder(Integer.MAX_VALUE)).isEqualTo("last");
    }
}
