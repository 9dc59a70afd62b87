package com.ids.authgate.security.filter;

import com.ids.authgate.security.authentication.AuthGateAuthentication;
import com.ids.authgate.security.directory.UserDirectory;
import com.ids.authgate.security.exception.UserNotFoundException;
import com.ids.authgate.security.model.SecurityPrincipal;
import com.ids.authgate.security.model.UserAccount;
import com.ids.authgate.security.model.UserCriteria;
import com.ids.authgate.security.session.HttpSessionContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.HttpSession;
import java.io.IOException;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContext;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * HTTP Session에 바인딩된 사용자 ID로 매 요청마다 사용자를 다시 조회하여 인증 객체를 만드는 필터입니다.
 * <p>
 * SecurityContext는 세션에 저장하지 않으므로, 역할 변경이나 비활성화가 다음 요청부터 즉시 반영됩니다.
 * 사용자가 삭제되었거나 비활성화되었으면 세션을 무효화합니다.
 * </p>
 */
@Slf4j
public class SessionAuthenticationFilter extends OncePerRequestFilter {

    private final UserDirectory userDirectory;

    public SessionAuthenticationFilter(UserDirectory userDirectory) {
        this.userDirectory = userDirectory;
    }

    @Override
    protected void doFilterInternal(
        HttpServletRequest request,
        HttpServletResponse response,
        FilterChain filterChain
    ) throws ServletException, IOException
    {
        Authentication existing = SecurityContextHolder.getContext().getAuthentication();
        Optional<String> userId = HttpSessionContext.getBoundUserId(request);

        if (existing == null && userId.isPresent()) {
            authenticateFromSession(request, userId.get());
        }

        filterChain.doFilter(request, response);
    }

    private void authenticateFromSession(HttpServletRequest request, String userId) {
        try {
            UserAccount user = userDirectory.findUser(UserCriteria.byId(userId));
            if (!user.isActive()) {
                log.debug("[Filter] 비활성 사용자의 세션을 무효화합니다: {}", userId);
                invalidate(request);
                return;
            }

            SecurityContext securityContext = SecurityContextHolder.createEmptyContext();
            securityContext.setAuthentication(new AuthGateAuthentication(SecurityPrincipal.of(user), AuthGateAuthentication.SESSION));
            SecurityContextHolder.setContext(securityContext);
            log.trace("[Filter] 세션 사용자 '{}' 복원 완료.", userId);
        } catch (UserNotFoundException e) {
            log.debug("[Filter] 세션에 바인딩된 사용자가 존재하지 않아 세션을 무효화합니다: {}", userId);
            invalidate(request);
        }
    }

    private void invalidate(HttpServletRequest request) {
        HttpSession session = request.getSession(false);
        if (session != null) {
            session.invalidate();
        }
    }
}
