package com.warden.portal.api;

import com.warden.portal.account.Member;
import com.warden.portal.account.MemberDirectory;
import com.warden.portal.account.MemberView;
import com.warden.sessionauth.web.AdminRequired;
import com.warden.sessionauth.web.CurrentAccount;
import com.warden.sessionauth.web.LoginRequired;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

/**
 * Guarded pages of the portal.
 */
@RestController
public class DashboardController {

    private static final Logger log = LoggerFactory.getLogger(DashboardController.class);

    private final MemberDirectory directory;

    public DashboardController(MemberDirectory directory) {
        this.directory = directory;
    }

    @GetMapping("/api/v1/me")
    public MemberView me(@CurrentAccount Member member) {
        return MemberView.of(member);
    }

    @LoginRequired
    @GetMapping("/dashboard")
    public Map<String, Object> dashboard(@CurrentAccount Member member) {
        return Map.of("greeting", "Welcome, " + member.displayName(), "member", MemberView.of(member));
    }

    @AdminRequired
    @GetMapping("/admin/members")
    public List<MemberView> members() {
        return directory.all().stream()
                .sorted(Comparator.comparing(Member::username))
                .map(MemberView::of)
                .toList();
    }

    /**
     * Removes a member. Their existing sessions degrade to anonymous on the next request.
     */
    @AdminRequired
    @DeleteMapping("/admin/members/{username}")
    public ResponseEntity<Void> removeMember(@PathVariable String username, @CurrentAccount Member admin) {
        if (!directory.remove(username)) {
            return ResponseEntity.notFound().build();
        }
        log.info("Member {} removed by {}", username, admin.username());
        return ResponseEntity.noContent().build();
    }
}
