package com.example.medialibrary.application.service;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.example.medialibrary.domain.model.SyncPreferences;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import org.junit.jupiter.api.Test;

class DirectoryRuleResolverTest {

    @Test
    void defaultAllowsEverythingWithoutRules() {
        DirectoryRuleResolver resolver = new DirectoryRuleResolver(null, null);

        assertTrue(resolver.isAllowed("/music/rock"));
        assertTrue(resolver.isAllowed("/"));
        assertFalse(resolver.hasRules());
    }

    @Test
    void blockedPrefixExcludesItselfAndSubdirectories() {
        DirectoryRuleResolver resolver = new DirectoryRuleResolver(
                Collections.singletonList("/music/podcasts"), Collections.<String>emptyList());

        assertFalse(resolver.isAllowed("/music/podcasts"));
        assertFalse(resolver.isAllowed("/music/podcasts/2024/"));
        assertTrue(resolver.isAllowed("/music/podcasts-archive"));
        assertTrue(resolver.isAllowed("/music"));
    }

    @Test
    void blockWinsOverBroaderOrEqualAllowEntries() {
        DirectoryRuleResolver resolver = new DirectoryRuleResolver(
                Collections.singletonList("/music/ringtones"),
                Arrays.asList("/music", "/music/ringtones"));

        assertFalse(resolver.isAllowed("/music/ringtones"));
        assertFalse(resolver.isAllowed("/music/ringtones/old"));
        assertTrue(resolver.isAllowed("/music/albums"));
    }

    @Test
    void moreSpecificAllowReopensBlockedSubtree() {
        DirectoryRuleResolver resolver = new DirectoryRuleResolver(
                Collections.singletonList("/downloads"),
                Collections.singletonList("/downloads/music"));

        assertTrue(resolver.isAllowed("/downloads/music/new"));
        assertFalse(resolver.isAllowed("/downloads/videos"));
    }

    @Test
    void nonEmptyAllowListRejectsUnmatchedPathsWithoutBlockRule() {
        DirectoryRuleResolver resolver = DirectoryRuleResolver.from(new SyncPreferences(
                null, new LinkedHashSet<>(Collections.singletonList("/music")), false));

        assertTrue(resolver.isAllowed("/music/jazz"));
        assertFalse(resolver.isAllowed("/recordings"));
        assertFalse(resolver.isAllowed(null));
    }

    @Test
    void pathsAreNormalizedBeforeMatching() {
        DirectoryRuleResolver resolver = new DirectoryRuleResolver(
                Collections.singletonList("C:\\Users\\me\\Music\\Blocked\\"), null);

        assertFalse(resolver.isAllowed("C:/Users/me/Music/Blocked/sub"));
        assertFalse(resolver.isAllowed("C:\\Users\\me\\Music\\Blocked"));
        assertTrue(resolver.isAllowed("C:/Users/me/Music/Open"));
    }
}
