package com.oblivionstack.security.policy;

import com.oblivionstack.security.BusinessId;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("ResourceRow")
class ResourceRowTest {

    @Test
    @DisplayName("keeps null column values and reports them as absent")
    void nullColumns() {
        Map<String, Object> columns = new LinkedHashMap<>();
        columns.put("archived_at", null);
        columns.put("status", "open");

        ResourceRow row = new ResourceRow(BusinessId.random(), null, columns);

        assertThat(row.attributes()).containsEntry("archived_at", null).containsEntry("status", "open");
        assertThat(row.attribute("archived_at")).isEmpty();
        assertThat(row.attribute("status")).contains("open");
    }

    @Test
    @DisplayName("is not affected by later changes to the source map and cannot be modified")
    void defensiveCopy() {
        Map<String, Object> columns = new HashMap<>();
        columns.put("status", "open");
        ResourceRow row = ResourceRow.unscoped(columns);

        columns.put("status", "closed");

        assertThat(row.attribute("status")).contains("open");
        assertThatThrownBy(() -> row.attributes().put("status", "closed"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("rejects a null column name")
    void nullName() {
        Map<String, Object> columns = new HashMap<>();
        columns.put(null, "x");

        assertThatThrownBy(() -> ResourceRow.unscoped(columns)).isInstanceOf(IllegalArgumentException.class);
    }
}
