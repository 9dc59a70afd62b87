package com.ids.authgate.security.authentication;

import com.ids.authgate.security.config.AuthGateSecurityConstants;
import com.ids.authgate.security.directory.UserDirectory;
import com.ids.authgate.security.model.SecurityPrincipal;
import com.ids.authgate.security.model.UserAccount;
import com.ids.authgate.security.model.UserCriteria;
import com.ids.authgate.security.session.HttpSessionContextFactory;
import com.ids.authgate.security.session.LoginSessionManager;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.SavedRequestAwareAuthenticationSuccessHandler;

/**
 * 폼 로그인 성공 후 {@link LoginSessionManager}로 세션 로그인을 완료하는 핸들러입니다.
 * <p>
 * {@code remember} 파라미터가 참이면 remember-me 쿠키를 발급합니다. 로그인 후에는
 * {@code next} 파라미터, 저장된 요청, post-login-view 순으로 이동하며
 * 다른 호스트를 가리키는 {@code next} 값은 무시합니다.
 * </p>
 */
@Slf4j
public class LoginSuccessHandler extends SavedRequestAwareAuthenticationSuccessHandler {

    private static final Set<String> TRUE_VALUES = Set.of("true", "on", "yes", "y", "1");

    private final UserDirectory userDirectory;
    private final LoginSessionManager sessionManager;
    private final HttpSessionContextFactory sessionContextFactory;
    private final String loginFailureUrl;

    public LoginSuccessHandler(
        UserDirectory userDirectory,
        LoginSessionManager sessionManager,
        HttpSessionContextFactory sessionContextFactory,
        String defaultSuccessUrl,
        String loginFailureUrl
    ) {
        this.userDirectory = userDirectory;
        this.sessionManager = sessionManager;
        this.sessionContextFactory = sessionContextFactory;
        this.loginFailureUrl = loginFailureUrl;
        setDefaultTargetUrl(defaultSuccessUrl);
        setTargetUrlParameter(AuthGateSecurityConstants.NEXT_PARAMETER);
    }

    @Override
    public void onAuthenticationSuccess(
        HttpServletRequest request,
        HttpServletResponse response,
        Authentication authentication
    ) throws IOException, ServletException {

        if (!(authentication.getPrincipal() instanceof SecurityPrincipal principal)) {
            log.warn("SecurityPrincipal 타입이 아니므로 세션 로그인을 진행할 수 없습니다. Authentication type: {}", authentication.getClass().getName());
            super.onAuthenticationSuccess(request, response, authentication);
            return;
        }

        UserAccount user = userDirectory.findUser(UserCriteria.byId(principal.getId()));
        boolean remember = isRememberRequested(request);

        if (!sessionManager.login(user, remember, sessionContextFactory.create(request, response))) {
            log.info("세션 로그인이 거부되었습니다: {}", user.getId());
            SecurityContextHolder.clearContext();
            getRedirectStrategy().sendRedirect(request, response, loginFailureUrl);
            return;
        }

        log.debug("폼 로그인 성공. 세션 로그인 완료: {}, remember={}", user.getId(), remember);
        super.onAuthenticationSuccess(request, response, authentication);
    }

    /**
     * 로그인 후 이동할 경로를 결정합니다. 같은 애플리케이션 내부 경로가 아니면 기본 경로를 사용합니다.
     */
    @Override
    protected String determineTargetUrl(HttpServletRequest request, HttpServletResponse response) {
        String targetUrl = super.determineTargetUrl(request, response);
        if (!isLocalUrl(targetUrl)) {
            log.debug("외부 경로로의 이동 요청을 무시합니다: {}", targetUrl);
            return getDefaultTargetUrl();
        }
        return targetUrl;
    }

    private boolean isRememberRequested(HttpServletRequest request) {
        String value = request.getParameter(AuthGateSecurityConstants.REMEMBER_PARAMETER);
        return value != null && TRUE_VALUES.contains(value.toLowerCase());
    }

    private boolean isLocalUrl(String url) {
        return url != null && url.startsWith("/") && !url.startsWith("//") && !url.startsWith("/\\");
    }
}
