package com.warden.portal.account;

import com.warden.portal.config.PortalProperties.MemberSeed;
import com.warden.sessionauth.AccountFactory;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory member store for the reference portal.
 * <p>
 * Also the {@link AccountFactory}: {@link #newAccount()} hands out the anonymous zero-value
 * member the resolver starts from. Shared by all requests, so entries live in a concurrent map;
 * the {@link Member} instances it returns are always fresh.
 */
public class MemberDirectory implements AccountFactory<Member> {

    private static final Logger log = LoggerFactory.getLogger(MemberDirectory.class);

    private record Entry(String username, byte[] password, String displayName, boolean admin) {}

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    public static MemberDirectory seededFrom(List<MemberSeed> seeds) {
        var directory = new MemberDirectory();
        seeds.forEach(seed -> directory.add(seed.username(), seed.password(), seed.displayName(), seed.admin()));
        log.info("Member directory seeded with {} member(s)", seeds.size());
        return directory;
    }

    public void add(String username, String password, String displayName, boolean admin) {
        entries.put(username, new Entry(username, password.getBytes(StandardCharsets.UTF_8), displayName, admin));
    }

    /**
     * Removes a member. Sessions still holding the username resolve as anonymous afterwards.
     */
    public boolean remove(String username) {
        return entries.remove(username) != null;
    }

    @Override
    public Member newAccount() {
        return new Member(this, null, null, false);
    }

    /**
     * Looks up a member without checking credentials. The result is not logged in.
     */
    public Optional<Member> find(String username) {
        return Optional.ofNullable(entries.get(username)).map(this::toMember);
    }

    /**
     * Returns the member if the password matches, not yet logged in.
     */
    public Optional<Member> verify(String username, String password) {
        if (username == null || password == null) {
            return Optional.empty();
        }
        Entry entry = entries.get(username);
        if (entry == null || !MessageDigest.isEqual(entry.password(), password.getBytes(StandardCharsets.UTF_8))) {
            return Optional.empty();
        }
        return Optional.of(toMember(entry));
    }

    public Collection<Member> all() {
        return entries.values().stream().map(this::toMember).toList();
    }

    private Member toMember(Entry entry) {
        return new Member(this, entry.username(), entry.displayName(), entry.admin());
    }
}
