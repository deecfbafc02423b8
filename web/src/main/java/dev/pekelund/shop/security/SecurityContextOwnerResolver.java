package dev.pekelund.shop.security;

import dev.pekelund.shop.auth.AuthenticationContextResolver;
import dev.pekelund.shop.auth.NotAuthenticatedException;
import java.util.Optional;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.oauth2.core.user.OAuth2User;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Resolves the owner of the current request from the Spring Security context.
 */
@Component
public class SecurityContextOwnerResolver implements AuthenticationContextResolver {

    @Override
    public String requireOwnerId() {
        return resolve(SecurityContextHolder.getContext().getAuthentication());
    }

    /**
     * Owner of the current request, or empty for anonymous requests.
     */
    public Optional<String> currentOwnerId() {
        return findOwnerId(SecurityContextHolder.getContext().getAuthentication());
    }

    String resolve(Authentication authentication) {
        if (!isSignedIn(authentication)) {
            throw new NotAuthenticatedException();
        }
        return findOwnerId(authentication)
            .orElseThrow(() -> new NotAuthenticatedException("The signed-in principal has no identifier"));
    }

    Optional<String> findOwnerId(Authentication authentication) {
        if (!isSignedIn(authentication)) {
            return Optional.empty();
        }

        String identifier = null;
        Object principal = authentication.getPrincipal();

        if (principal instanceof FirebasePrincipal firebasePrincipal) {
            identifier = firebasePrincipal.uid();
        } else if (principal instanceof OAuth2User oAuth2User) {
            Object subject = oAuth2User.getAttributes().get("sub");
            identifier = subject instanceof String text && StringUtils.hasText(text) ? text : oAuth2User.getName();
        } else if (principal instanceof UserDetails userDetails) {
            identifier = userDetails.getUsername();
        } else if (principal instanceof String stringPrincipal) {
            identifier = stringPrincipal;
        }

        if (!StringUtils.hasText(identifier)) {
            identifier = authentication.getName();
        }
        return StringUtils.hasText(identifier) ? Optional.of(identifier) : Optional.empty();
    }

    private static boolean isSignedIn(Authentication authentication) {
        return authentication != null
            && authentication.isAuthenticated()
            && !(authentication instanceof AnonymousAuthenticationToken);
    }
}
