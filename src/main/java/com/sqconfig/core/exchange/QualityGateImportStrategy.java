package com.sqconfig.core.exchange;

import com.fasterxml.jackson.databind.JsonNode;
import com.sqconfig.core.client.Platform;
import com.sqconfig.core.model.ObjectType;
import com.sqconfig.core.model.QualityGate;
import com.sqconfig.core.model.QualityGateCondition;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

class QualityGateImportStrategy implements ImportStrategy {

    @Override
    public ObjectType type() {
        return ObjectType.QUALITY_GATE;
    }

    @Override
    public List<ImportItem> items(JsonNode section) {
        return ImportItem.fromSection(type(), section);
    }

    @Override
    public Optional<String> skipReason(ImportItem item) {
        return item.data().path("isBuiltIn").asBoolean(false) ? Optional.of("built-in") : Optional.empty();
    }

    @Override
    public boolean exists(Platform platform, ImportItem item) {
        return QualityGate.exists(platform, item.key());
    }

    @Override
    public void create(Platform platform, ImportItem item) {
        QualityGate.create(platform, item.key());
    }

    @Override
    public void compose(Platform platform, ImportItem item) {
        var gate = QualityGate.get(platform, item.key());
        if (gate.isBuiltIn()) {
            return;
        }
        var wanted = new ArrayList<QualityGateCondition>();
        item.data().path("conditions").forEach(c -> wanted.add(QualityGateCondition.decode(c.asText())));
        gate.setConditions(wanted);
        if (item.data().path("isDefault").asBoolean(false) && !gate.isDefault()) {
            gate.setAsDefault();
        }
    }
}
