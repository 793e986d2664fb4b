package com.agentstrike.scanner;

import com.agentstrike.model.PayloadRisk;
import com.agentstrike.model.VulnClass;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Expands a job into probes. Pure: the same inputs always give the same plan,
 * and nothing here touches the network or a backend.
 */
public final class ScanPlanner {

    /**
     * @param probes         probes to dispatch, point-major then class then payload order
     * @param skippedByRisk  triples refused by {@link RiskGate}
     * @param skippedNoOob   triples needing an out-of-band token while none is available
     */
    public record Plan(List<PlannedProbe> probes, int skippedByRisk, int skippedNoOob) {
        public Plan {
            probes = List.copyOf(probes);
        }
    }

    private final PayloadLibrary library;

    public ScanPlanner(PayloadLibrary library) {
        this.library = library;
    }

    /**
     * For every point and class, takes the class's payloads in library order,
     * drops those over the ceiling (counted) and those needing OOB when it is
     * unavailable (counted), and keeps at most {@code maxPayloadsPerPoint} of the rest.
     */
    public Plan plan(List<InjectionPoint> points, Collection<VulnClass> classes, PayloadRisk ceiling,
                     int maxPayloadsPerPoint, boolean oobAvailable) {
        List<PlannedProbe> probes = new ArrayList<>();
        int skippedByRisk = 0;
        int skippedNoOob = 0;
        for (InjectionPoint point : points) {
            for (VulnClass vulnClass : classes) {
                int taken = 0;
                for (Payload payload : library.payloadsFor(vulnClass)) {
                    if (!RiskGate.permits(payload, ceiling)) {
                        skippedByRisk++;
                        continue;
                    }
                    if (payload.oob() && !oobAvailable) {
                        skippedNoOob++;
                        continue;
                    }
                    if (taken >= maxPayloadsPerPoint) continue;
                    probes.add(new PlannedProbe(point, payload));
                    taken++;
                }
            }
        }
        return new Plan(probes, skippedByRisk, skippedNoOob);
    }
}
