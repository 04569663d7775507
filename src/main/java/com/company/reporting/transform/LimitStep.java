package com.company.reporting.transform;

import com.company.reporting.domain.enums.TransformStepType;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Map;

@Getter
@ToString
public class LimitStep implements TransformStep {

    private final int limit;

    public LimitStep(int limit) {
        this.limit = Math.max(0, limit);
    }

    @Override
    public TransformStepType getType() {
        return TransformStepType.LIMIT;
    }

    @Override
    public List<Map<String, Object>> apply(List<Map<String, Object>> rows) {
        if (rows.size() <= limit) {
            return rows;
        }
        return List.copyOf(rows.subList(0, limit));
    }
}
