package org.jagriti.casesearch.services;

import org.jagriti.casesearch.clients.jagriti.JagritiClient;
import org.jagriti.casesearch.domain.CommissionEntry;

import java.util.List;
import java.util.Optional;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Maps display names typed by users to the numeric commission identifiers the portal expects.
 * Every lookup fetches a fresh directory. Names are compared case-insensitively on the full
 * string; when several entries share a name the first in portal order wins.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DirectoryResolver {

    private final JagritiClient jagritiClient;

    public Optional<Integer> resolveState(final String stateName) {
        final Optional<Integer> id = findByName(jagritiClient.fetchStateDirectory(), stateName);
        if (id.isPresent()) {
            log.info("Found commission ID {} for state {}", id.get(), stateName);
        } else {
            log.warn("State '{}' not found", stateName);
        }
        return id;
    }

    public Optional<Integer> resolveDistrict(final int stateCommissionId, final String commissionName) {
        final Optional<Integer> id =
                findByName(jagritiClient.fetchDistrictDirectory(stateCommissionId), commissionName);
        if (id.isPresent()) {
            log.info("Found district commission ID {} for district {}", id.get(), commissionName);
        } else {
            log.warn("District '{}' not found in state commission {}", commissionName, stateCommissionId);
        }
        return id;
    }

    public Optional<String> resolveStateName(final int stateCommissionId) {
        return jagritiClient.fetchStateDirectory().stream()
                .filter(entry -> entry.id() == stateCommissionId)
                .map(CommissionEntry::displayName)
                .findFirst();
    }

    static Optional<Integer> findByName(final List<CommissionEntry> directory, final String name) {
        if (name == null) {
            return Optional.empty();
        }
        return directory.stream()
                .filter(entry -> entry.displayName().equalsIgnoreCase(name))
                .map(CommissionEntry::id)
                .findFirst();
    }
}
