package com.matchmate.backend.modules.discovery.application;

import java.util.List;

import com.matchmate.backend.modules.auth.domain.AppUser;

import org.springframework.stereotype.Component;

/**
 * Keeps whatever order the store returned the rows in.
 */
@Component
public class StoreOrderRankingStrategy implements CandidateRankingStrategy {

    @Override
    public List<AppUser> rank(AppUser requester, List<AppUser> candidates) {
        return candidates;
    }
}
