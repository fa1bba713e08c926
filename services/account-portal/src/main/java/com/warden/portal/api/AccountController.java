package com.warden.portal.api;

import com.warden.portal.account.InvalidCredentialsException;
import com.warden.portal.account.Member;
import com.warden.portal.account.MemberDirectory;
import com.warden.sessionauth.SessionAuthSettings;
import com.warden.sessionauth.SessionAuthenticator;
import com.warden.sessionauth.SessionStore;
import com.warden.sessionauth.web.CurrentAccount;
import jakarta.servlet.http.HttpServletRequest;
import java.net.URI;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Login and logout endpoints.
 *
 * <p>Credentials are checked against the {@link MemberDirectory}; on success the member is handed
 * to {@link SessionAuthenticator#authenticate} and the client is sent back to the page the guard
 * intercepted (the redirect parameter), or to {@code /}.
 */
@RestController
public class AccountController {

    private static final Logger log = LoggerFactory.getLogger(AccountController.class);

    private final MemberDirectory directory;
    private final SessionAuthenticator authenticator;
    private final SessionAuthSettings settings;

    public AccountController(
            MemberDirectory directory, SessionAuthenticator authenticator, SessionAuthSettings settings) {
        this.directory = directory;
        this.authenticator = authenticator;
        this.settings = settings;
    }

    @GetMapping({"/account/login", "/admin/account/login"})
    public Map<String, Object> loginForm(HttpServletRequest request, @CurrentAccount Member member) {
        return Map.of(
                "action", request.getRequestURI(),
                "param", settings.redirectParam(),
                "next", safeNext(request.getParameter(settings.redirectParam())),
                "authenticated", member.isAuthenticated());
    }

    @PostMapping("/account/login")
    public ResponseEntity<Void> login(
            @RequestParam String username,
            @RequestParam String password,
            HttpServletRequest request,
            SessionStore session) {
        Member member = directory.verify(username, password)
                .orElseThrow(() -> new InvalidCredentialsException(username));
        return signIn(member, request, session);
    }

    @PostMapping("/admin/account/login")
    public ResponseEntity<Void> adminLogin(
            @RequestParam String username,
            @RequestParam String password,
            HttpServletRequest request,
            SessionStore session) {
        Member member = directory.verify(username, password)
                .filter(Member::isAdmin)
                .orElseThrow(() -> new InvalidCredentialsException(username));
        return signIn(member, request, session);
    }

    @PostMapping("/account/logout")
    public ResponseEntity<Void> logout(@CurrentAccount Member member, SessionStore session) {
        authenticator.logout(session, member);
        log.info("Member {} logged out", member.username());
        return found(URI.create(settings.redirectUrl()));
    }

    private ResponseEntity<Void> signIn(Member member, HttpServletRequest request, SessionStore session) {
        if (request.getSession(false) != null) {
            // Session fixation.
            request.changeSessionId();
        }
        authenticator.authenticate(session, member);
        log.info("Member {} logged in", member.username());

        String next = safeNext(request.getParameter(settings.redirectParam()));
        return found(UriComponentsBuilder.fromPath(next).build().encode().toUri());
    }

    private static ResponseEntity<Void> found(URI location) {
        return ResponseEntity.status(HttpStatus.FOUND).location(location).build();
    }

    /** Only same-site absolute paths; anything else lands on the home page. */
    static String safeNext(String next) {
        if (next == null || next.isBlank() || !next.startsWith("/") || next.startsWith("//")
                || next.startsWith("/\\")) {
            return "/";
        }
        return next;
    }
}
