package org.rtlgraph.export;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ExportOptionsTest {

    @Test
    void defaultsMatchTheReferenceConfiguration() {
        ExportOptions fromReference = ExportOptions.fromConfig(ConfigFactory.defaultReference());

        assertThat(fromReference).isEqualTo(ExportOptions.defaults());
    }

    @Test
    void missingKeysKeepDefaults() {
        ExportOptions options = ExportOptions.fromConfig(ConfigFactory.parseString(
                "rtlgraph.export { format = JSON, bus-label-threshold = 5 }"));

        assertThat(options.format()).isEqualTo(ExportFormat.JSON);
        assertThat(options.busLabelThreshold()).isEqualTo(5);
        assertThat(options.viewerPage()).isEqualTo("viewer.html");
        assertThat(options.withFormat(ExportFormat.DOT).busLabelThreshold()).isEqualTo(5);
    }

    @Test
    void unknownFormatIsRejected() {
        assertThat(ExportFormat.parse(" Dot ")).isEqualTo(ExportFormat.DOT);
        assertThatThrownBy(() -> ExportFormat.parse("svg"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("svg");
    }
}
