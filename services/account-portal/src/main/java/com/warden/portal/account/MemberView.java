package com.warden.portal.account;

/**
 * JSON view of a member.
 *
 * @param username null for anonymous visitors
 * @param displayName null for anonymous visitors
 * @param admin whether the member holds admin privilege
 * @param authenticated whether the member is logged in for this request
 */
public record MemberView(String username, String displayName, boolean admin, boolean authenticated) {

    public static MemberView of(Member member) {
        return new MemberView(member.username(), member.displayName(), member.isAdmin(), member.isAuthenticated());
    }
}
