package com.ids.authgate.security.util;

import com.ids.authgate.security.config.AuthGateSecurityConstants;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.servlet.FlashMap;
import org.springframework.web.servlet.FlashMapManager;
import org.springframework.web.servlet.support.SessionFlashMapManager;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * 리다이렉트 대상 요청에 전달할 플래시 메시지를 저장합니다.
 * <p>
 * Security 필터 체인은 DispatcherServlet 앞에서 동작하므로, 요청 속성의 FlashMap 대신
 * {@link SessionFlashMapManager}에 직접 저장합니다. 컨트롤러에서는 {@code RedirectAttributes}의
 * 플래시 속성과 동일하게 {@code message}, {@code category} 모델 속성으로 읽을 수 있습니다.
 * </p>
 */
@Slf4j
@UtilityClass
public class FlashMessageUtil {

    private static final FlashMapManager FLASH_MAP_MANAGER = new SessionFlashMapManager();

    public static void flash(HttpServletRequest request, HttpServletResponse response,
                             String targetUrl, String message, String category) {
        FlashMap flashMap = new FlashMap();
        flashMap.put(AuthGateSecurityConstants.FLASH_MESSAGE_KEY, message);
        flashMap.put(AuthGateSecurityConstants.FLASH_CATEGORY_KEY, category);
        flashMap.setTargetRequestPath(UriComponentsBuilder.fromUriString(targetUrl).build().getPath());
        FLASH_MAP_MANAGER.saveOutputFlashMap(flashMap, request, response);
        log.trace("플래시 메시지 저장: target={}, category={}", targetUrl, category);
    }
}
