package com.complypilot.controller;

import com.complypilot.config.ComplyPilotProperties;
import com.complypilot.model.User;
import com.complypilot.service.SessionService;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Resolves {@link CurrentUser} parameters from the request's session token.
 */
public class CurrentUserArgumentResolver implements HandlerMethodArgumentResolver {

    private final SessionService sessionService;
    private final String cookieName;

    public CurrentUserArgumentResolver(SessionService sessionService, ComplyPilotProperties properties) {
        this.sessionService = sessionService;
        this.cookieName = properties.session().cookieName();
    }

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return parameter.hasParameterAnnotation(CurrentUser.class)
                && User.class.isAssignableFrom(parameter.getParameterType());
    }

    @Override
    public User resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        HttpServletRequest request = webRequest.getNativeRequest(HttpServletRequest.class);
        String token = request != null ? SessionTokens.extract(request, cookieName) : null;
        return sessionService.authenticate(token);
    }
}
