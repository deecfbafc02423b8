package dev.pekelund.shop.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.google.firebase.auth.FirebaseAuth;
import com.google.firebase.auth.FirebaseAuthException;
import com.google.firebase.auth.FirebaseToken;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

class FirebaseIdTokenFilterTests {

    private FirebaseAuth firebaseAuth;
    private FirebaseIdTokenFilter filter;
    private AtomicReference<Authentication> seen;
    private MockFilterChain chain;

    @BeforeEach
    void setUp() {
        firebaseAuth = mock(FirebaseAuth.class);
        filter = new FirebaseIdTokenFilter(firebaseAuth);
        seen = new AtomicReference<>();
        chain = new MockFilterChain(new HttpServlet() {
            @Override
            protected void service(HttpServletRequest req, HttpServletResponse resp) {
                seen.set(SecurityContextHolder.getContext().getAuthentication());
            }
        });
    }

    @AfterEach
    void clearContext() {
        SecurityContextHolder.clearContext();
    }

    @Test
    void authenticatesValidBearerToken() throws Exception {
        FirebaseToken token = mock(FirebaseToken.class);
        when(token.getUid()).thenReturn("uid-1");
        when(token.getEmail()).thenReturn("ada@example.com");
        when(firebaseAuth.verifyIdToken("good-token")).thenReturn(token);
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("Authorization", "Bearer good-token");

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(seen.get()).isNotNull();
        assertThat(seen.get().getPrincipal()).isEqualTo(new FirebasePrincipal("uid-1", "ada@example.com"));
        assertThat(seen.get().isAuthenticated()).isTrue();
    }

    @Test
    void invalidTokenLeavesRequestUnauthenticated() throws Exception {
        when(firebaseAuth.verifyIdToken("bad-token")).thenThrow(mock(FirebaseAuthException.class));
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("Authorization", "Bearer bad-token");

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertThat(seen.get()).isNull();
    }

    @Test
    void ignoresRequestsWithoutBearerToken() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("Authorization", "Basic ZGVtbzpkZW1v");

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        verifyNoInteractions(firebaseAuth);
        assertThat(seen.get()).isNull();
    }
}
