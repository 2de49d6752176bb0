package org.jagriti.casesearch.services;

import org.jagriti.casesearch.clients.jagriti.JagritiClient;
import org.jagriti.casesearch.domain.CommissionEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("Directory Resolver tests")
class DirectoryResolverTest {

    private static final List<CommissionEntry> STATES = List.of(
            new CommissionEntry(11070000, "DELHI", true, false),
            new CommissionEntry(11290000, "KARNATAKA", true, false),
            new CommissionEntry(11299999, "Karnataka", false, true)
    );

    @Mock
    private JagritiClient jagritiClient;

    @InjectMocks
    private DirectoryResolver resolver;

    @Test
    @DisplayName("State match ignores case and first entry wins")
    void resolveState_caseInsensitiveFirstWins() {
        when(jagritiClient.fetchStateDirectory()).thenReturn(STATES);

        assertThat(resolver.resolveState("karnataka")).contains(11290000);
    }

    @Test
    @DisplayName("Unknown state resolves to empty")
    void resolveState_unknown() {
        when(jagritiClient.fetchStateDirectory()).thenReturn(STATES);

        assertThat(resolver.resolveState("ATLANTIS")).isEmpty();
    }

    @Test
    @DisplayName("Partial names do not match")
    void resolveState_noPartialMatch() {
        when(jagritiClient.fetchStateDirectory()).thenReturn(STATES);

        assertThat(resolver.resolveState("KARNA")).isEmpty();
    }

    @Test
    @DisplayName("District lookup uses the state commission id")
    void resolveDistrict_queriesState() {
        when(jagritiClient.fetchDistrictDirectory(11290000)).thenReturn(List.of(
                new CommissionEntry(15290525, "Bangalore 1st & Rural Additional", true, false)));

        assertThat(resolver.resolveDistrict(11290000, "BANGALORE 1ST & RURAL ADDITIONAL")).contains(15290525);
        verify(jagritiClient).fetchDistrictDirectory(11290000);
    }

    @Test
    @DisplayName("Inactive entries are still resolvable")
    void resolveDistrict_ignoresActiveFlag() {
        when(jagritiClient.fetchDistrictDirectory(11290000)).thenReturn(List.of(
                new CommissionEntry(15290001, "Mysore", false, false)));

        assertThat(resolver.resolveDistrict(11290000, "Mysore")).contains(15290001);
    }

    @Test
    @DisplayName("State name reverse lookup")
    void resolveStateName() {
        when(jagritiClient.fetchStateDirectory()).thenReturn(STATES);

        assertThat(resolver.resolveStateName(11070000)).contains("DELHI");
        assertThat(resolver.resolveStateName(42)).isEmpty();
    }

    @Test
    @DisplayName("Null or empty directory never matches")
    void findByName_edgeCases() {
        assertThat(DirectoryResolver.findByName(STATES, null)).isEmpty();
        assertThat(DirectoryResolver.findByName(List.of(), "DELHI")).isEmpty();
    }
}
