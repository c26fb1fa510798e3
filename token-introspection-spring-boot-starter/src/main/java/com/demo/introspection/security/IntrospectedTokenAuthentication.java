package com.demo.introspection.security;

import com.demo.introspection.model.IntrospectionVerdict;
import org.springframework.security.authentication.AbstractAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 内省通过后写入 SecurityContext 的认证信息。
 * <p>
 * 约定：principal 依次取 sub / username / client_id；scope（空格分隔或数组）映射为 SCOPE_xxx 权限。
 * <p>
 * 不保存令牌本身，getCredentials() 恒为空字符串。
 */
public class IntrospectedTokenAuthentication extends AbstractAuthenticationToken {

    public static final String AUTHORITY_PREFIX = "SCOPE_";

    private final String principal;
    private final transient IntrospectionVerdict verdict;

    public IntrospectedTokenAuthentication(IntrospectionVerdict verdict,
                                           Collection<? extends GrantedAuthority> authorities) {
        super(authorities);
        this.verdict = Objects.requireNonNull(verdict, "verdict must not be null");
        this.principal = resolvePrincipal(verdict);
        setAuthenticated(true);
    }

    public static IntrospectedTokenAuthentication from(IntrospectionVerdict verdict) {
        return new IntrospectedTokenAuthentication(verdict, scopeAuthorities(verdict));
    }

    @Override
    public Object getCredentials() {
        return "";
    }

    @Override
    public Object getPrincipal() {
        return principal;
    }

    public IntrospectionVerdict getVerdict() {
        return verdict;
    }

    private static String resolvePrincipal(IntrospectionVerdict verdict) {
        String sub = verdict.claimAsString(IntrospectionVerdict.CLAIM_SUB);
        if (sub != null) return sub;
        String username = verdict.claimAsString(IntrospectionVerdict.CLAIM_USERNAME);
        if (username != null) return username;
        return verdict.claimAsString(IntrospectionVerdict.CLAIM_CLIENT_ID);
    }

    static List<GrantedAuthority> scopeAuthorities(IntrospectionVerdict verdict) {
        Object scope = verdict.claims().get(IntrospectionVerdict.CLAIM_SCOPE);
        Set<String> scopes = new LinkedHashSet<>();
        if (scope instanceof String s) {
            for (String part : s.trim().split("\\s+")) {
                if (!part.isEmpty()) scopes.add(part);
            }
        } else if (scope instanceof Collection<?> c) {
            for (Object x : c) {
                if (x == null) continue;
                String v = String.valueOf(x).trim();
                if (!v.isEmpty()) scopes.add(v);
            }
        }
        List<GrantedAuthority> authorities = new ArrayList<>(scopes.size());
        for (String s : scopes) {
            authorities.add(new SimpleGrantedAuthority(AUTHORITY_PREFIX + s));
        }
        return authorities;
    }
}
