package com.commerce.extobject.diagnostics;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps every diagnostic it receives, for reporting after a run.
 */
public class CollectingDiagnosticsSink implements DiagnosticsSink {
    private final List<MissingAttributeDiagnostic> missingAttributes = new CopyOnWriteArrayList<>();

    @Override
    public void missingAttribute(MissingAttributeDiagnostic diagnostic) {
        missingAttributes.add(diagnostic);
    }

    public List<MissingAttributeDiagnostic> getMissingAttributes() {
        return List.copyOf(missingAttributes);
    }

    public boolean isEmpty() {
        return missingAttributes.isEmpty();
    }
}
