package com.idgate.auth;

import com.idgate.keys.InMemoryKeyValueCache;
import com.idgate.keys.KeyValueCache;
import com.idgate.token.ClaimMap;
import com.idgate.token.ClaimPredicate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("ProjectAuthenticator")
class ProjectAuthenticatorTest {

    private final FirebaseAuthenticator delegate = mock(FirebaseAuthenticator.class);
    private final KeyValueCache cache = new InMemoryKeyValueCache();

    @Test
    @DisplayName("passes its project and cache to the authenticator")
    void delegates() {
        var claims = ClaimMap.of(Map.of("sub", "uid-1"));
        when(delegate.authenticate("p1", cache, "t")).thenReturn(Optional.of(claims));

        var bound = new ProjectAuthenticator(delegate, "p1", cache);

        assertThat(bound.authenticate("t")).contains(claims);
        assertThat(bound.projectId()).isEqualTo("p1");
    }

    @Test
    @DisplayName("forwards extra checks")
    void forwardsChecks() {
        List<ClaimPredicate> checks = List.of(c -> true);
        when(delegate.authenticate(eq("p1"), same(cache), eq("t"), anyList())).thenReturn(Optional.empty());

        new ProjectAuthenticator(delegate, "p1", cache).authenticate("t", checks);

        verify(delegate).authenticate("p1", cache, "t", checks);
    }

    @Test
    @DisplayName("rejects a blank project id")
    void blankProject() {
        assertThatThrownBy(() -> new ProjectAuthenticator(delegate, "", cache))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("projectId");
    }
}
