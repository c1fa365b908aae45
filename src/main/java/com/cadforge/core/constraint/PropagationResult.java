package com.cadforge.core.constraint;

import com.cadforge.core.model.Constraint;
import com.cadforge.core.model.ConstraintStatus;

import java.util.List;

/**
 * Constraints re-evaluated after an entity changed.
 *
 * @param entityId     the changed entity
 * @param component    entity ids of its connected component
 * @param reevaluated  constraints of that component with fresh evaluations
 */
public record PropagationResult(
    String entityId,
    List<String> component,
    List<Constraint> reevaluated
) {

    public PropagationResult {
        component = List.copyOf(component);
        reevaluated = List.copyOf(reevaluated);
    }

    public long violatedCount() {
        return reevaluated.stream().filter(c -> c.status() == ConstraintStatus.VIOLATED).count();
    }
}
