package com.medconsult.auth;

import com.medconsult.exception.UnauthorizedException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.core.MethodParameter;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Builds the {@link ActingPrincipal} of a request from the headers the identity
 * provider sets in front of this service.
 */
@Component
public class ActingPrincipalResolver implements HandlerMethodArgumentResolver {

    public static final String USER_ID_HEADER = "X-User-Id";
    public static final String USER_ROLE_HEADER = "X-User-Role";

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return ActingPrincipal.class.equals(parameter.getParameterType());
    }

    @Override
    public ActingPrincipal resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                           NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        String rawId = webRequest.getHeader(USER_ID_HEADER);
        String rawRole = webRequest.getHeader(USER_ROLE_HEADER);
        if (StringUtils.isBlank(rawId) || StringUtils.isBlank(rawRole)) {
            throw new UnauthorizedException("Missing identity headers.");
        }
        Role role = Role.parse(rawRole)
                .orElseThrow(() -> new UnauthorizedException("Unknown role: " + rawRole));
        long id;
        try {
            id = Long.parseLong(rawId.trim());
        } catch (NumberFormatException e) {
            throw new UnauthorizedException("Invalid user id: " + rawId);
        }
        return new ActingPrincipal(id, role);
    }
}
