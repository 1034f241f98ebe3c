package com.matchmate.backend.modules.discovery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.matchmate.backend.global.error.ProblemException;
import com.matchmate.backend.modules.auth.domain.AppUser;
import com.matchmate.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.matchmate.backend.modules.discovery.application.CandidateRankingStrategy;
import com.matchmate.backend.modules.discovery.application.DiscoveryService;
import com.matchmate.backend.modules.discovery.application.StoreOrderRankingStrategy;
import com.matchmate.backend.modules.profile.presentation.dto.ProfileResponse;
import com.matchmate.backend.modules.swipe.application.SwipeLedger;
import com.matchmate.backend.support.TestUsers;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class DiscoveryServiceTest {

    private static final String ALICE_ID = "00000000-0000-0000-0000-000000000001";
    private static final String BOB_ID = "00000000-0000-0000-0000-000000000002";
    private static final String CAROL_ID = "00000000-0000-0000-0000-000000000003";
    private static final String DAVE_ID = "00000000-0000-0000-0000-000000000004";

    @Mock
    private AppUserRepository appUserRepository;

    @Mock
    private SwipeLedger swipeLedger;

    private AppUser alice;
    private AppUser bob;
    private AppUser carol;
    private AppUser dave;

    @BeforeEach
    void setUp() {
        alice = TestUsers.user(ALICE_ID, "Alice");
        bob = TestUsers.user(BOB_ID, "Bob");
        carol = TestUsers.user(CAROL_ID, "Carol");
        dave = TestUsers.user(DAVE_ID, "Dave");
    }

    @Test
    void excludesRequesterAndEverySwipedTarget() {
        DiscoveryService service = new DiscoveryService(appUserRepository, swipeLedger, new StoreOrderRankingStrategy(), 50);
        when(appUserRepository.findById(alice.getId())).thenReturn(Optional.of(alice));
        when(swipeLedger.swipedTargets(alice.getId())).thenReturn(Set.of(bob.getId()));
        when(appUserRepository.findAll(PageRequest.of(0, 50)))
                .thenReturn(new PageImpl<>(List.of(alice, bob, carol, dave)));

        List<ProfileResponse> profiles = service.discover(alice.getId());

        assertThat(profiles).extracting(ProfileResponse::id).containsExactly(CAROL_ID, DAVE_ID);
    }

    @Test
    void profilesNeverExposeCredentialHash() {
        DiscoveryService service = new DiscoveryService(appUserRepository, swipeLedger, new StoreOrderRankingStrategy(), 50);
        when(appUserRepository.findById(alice.getId())).thenReturn(Optional.of(alice));
        when(swipeLedger.swipedTargets(alice.getId())).thenReturn(Set.of());
        when(appUserRepository.findAll(PageRequest.of(0, 50))).thenReturn(new PageImpl<>(List.of(bob)));

        List<ProfileResponse> profiles = service.discover(alice.getId());

        assertThat(ProfileResponse.class.getRecordComponents())
                .extracting(component -> component.getName())
                .doesNotContain("passwordHash");
        assertThat(profiles).singleElement().satisfies(profile -> {
            assertThat(profile.id()).isEqualTo(BOB_ID);
            assertThat(profile.name()).isEqualTo("Bob");
        });
    }

    @Test
    void scanCapAppliesBeforeFiltering() {
        DiscoveryService service = new DiscoveryService(appUserRepository, swipeLedger, new StoreOrderRankingStrategy(), 2);
        when(appUserRepository.findById(alice.getId())).thenReturn(Optional.of(alice));
        when(swipeLedger.swipedTargets(alice.getId())).thenReturn(Set.of(bob.getId()));
        when(appUserRepository.findAll(PageRequest.of(0, 2))).thenReturn(new PageImpl<>(List.of(alice, bob)));

        // carol and dave exist beyond the scanned page but are not surfaced
        assertThat(service.discover(alice.getId())).isEmpty();
    }

    @Test
    void rankingStrategyOrdersTheSurvivors() {
        CandidateRankingStrategy reversed = (requester, candidates) -> {
            List<AppUser> copy = new ArrayList<>(candidates);
            Collections.reverse(copy);
            return copy;
        };
        DiscoveryService service = new DiscoveryService(appUserRepository, swipeLedger, reversed, 50);
        when(appUserRepository.findById(alice.getId())).thenReturn(Optional.of(alice));
        when(swipeLedger.swipedTargets(alice.getId())).thenReturn(Set.of());
        when(appUserRepository.findAll(PageRequest.of(0, 50)))
                .thenReturn(new PageImpl<>(List.of(alice, bob, carol)));

        assertThat(service.discover(alice.getId()))
                .extracting(ProfileResponse::id)
                .containsExactly(CAROL_ID, BOB_ID);
    }

    @Test
    void unknownRequesterIsUnauthorized() {
        DiscoveryService service = new DiscoveryService(appUserRepository, swipeLedger, new StoreOrderRankingStrategy(), 50);
        UUID ghost = UUID.randomUUID();
        when(appUserRepository.findById(ghost)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.discover(ghost))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED));
    }

    @Test
    void rejectsNonPositiveScanLimit() {
        assertThatThrownBy(() -> new DiscoveryService(appUserRepository, swipeLedger, new StoreOrderRankingStrategy(), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
