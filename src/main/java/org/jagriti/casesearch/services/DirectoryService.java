package org.jagriti.casesearch.services;

import org.jagriti.casesearch.clients.jagriti.JagritiClient;
import org.jagriti.casesearch.domain.CommissionEntry;
import org.jagriti.casesearch.domain.DistrictCommission;
import org.jagriti.casesearch.domain.DistrictListing;
import org.jagriti.casesearch.domain.StateCommission;
import org.jagriti.casesearch.domain.StateListing;
import org.jagriti.casesearch.services.exception.CommissionNotFoundException;

import java.util.Comparator;
import java.util.List;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class DirectoryService {

    private final JagritiClient jagritiClient;
    private final DirectoryResolver directoryResolver;

    /**
     * Active, permanent state commissions sorted by name. Circuit benches are left out.
     */
    public StateListing listStates() {
        final List<StateCommission> states = jagritiClient.fetchStateDirectory().stream()
                .filter(entry -> entry.active() && !entry.circuitBench())
                .sorted(Comparator.comparing(CommissionEntry::displayName))
                .map(StateCommission::from)
                .toList();
        log.info("Retrieved {} states", states.size());
        return StateListing.of(states);
    }

    /**
     * Active district commissions of a state sorted by name, together with the state's name.
     *
     * @throws CommissionNotFoundException when no state carries {@code stateId}
     */
    public DistrictListing listDistrictCommissions(final int stateId) {
        final String stateName = directoryResolver.resolveStateName(stateId)
                .orElseThrow(() -> CommissionNotFoundException.stateId(stateId));

        final List<DistrictCommission> commissions = jagritiClient.fetchDistrictDirectory(stateId).stream()
                .filter(CommissionEntry::active)
                .sorted(Comparator.comparing(CommissionEntry::displayName))
                .map(DistrictCommission::from)
                .toList();
        log.info("Retrieved {} district commissions for state {}", commissions.size(), stateName);
        return DistrictListing.of(stateId, stateName, commissions);
    }
}
