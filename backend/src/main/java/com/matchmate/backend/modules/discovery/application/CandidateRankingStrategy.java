package com.matchmate.backend.modules.discovery.application;

import java.util.List;

import com.matchmate.backend.modules.auth.domain.AppUser;

/**
 * Orders the already-filtered discovery candidates for a requester.
 * Implementations must not add candidates that were not passed in.
 */
public interface CandidateRankingStrategy {

    List<AppUser> rank(AppUser requester, List<AppUser> candidates);
}
