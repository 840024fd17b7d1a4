package com.civiclens.ingestion.store;

import com.civiclens.config.CaffeineConfig;
import com.civiclens.domain.Member;
import com.civiclens.domain.MemberRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

/**
 * Resolves bioguide ids to local member ids for sponsors and cosponsors. Hits are cached; misses are not,
 * so a member mirrored later resolves on the next bill sync.
 */
@Component
@RequiredArgsConstructor
public class MemberLookup {

    private final MemberRepository memberRepository;

    @Cacheable(cacheNames = CaffeineConfig.MEMBER_ID_CACHE, key = "#bioguideId",
            condition = "#bioguideId != null && !#bioguideId.isBlank()", unless = "#result == null")
    public String findMemberId(String bioguideId) {
        if (bioguideId == null || bioguideId.isBlank()) {
            return null;
        }
        return memberRepository.findByBioguideId(bioguideId).map(Member::getId).orElse(null);
    }
}
