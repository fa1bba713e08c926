package com.warden.sessionauth.web;

import com.warden.sessionauth.Account;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Resolves {@link CurrentAccount}-annotated parameters to the account bound to the request.
 */
public class CurrentAccountArgumentResolver implements HandlerMethodArgumentResolver {

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return parameter.hasParameterAnnotation(CurrentAccount.class)
                && Account.class.isAssignableFrom(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(
            MethodParameter parameter,
            ModelAndViewContainer mavContainer,
            NativeWebRequest webRequest,
            WebDataBinderFactory binderFactory) {
        HttpServletRequest request = webRequest.getNativeRequest(HttpServletRequest.class);
        if (request == null) {
            throw new IllegalStateException("@CurrentAccount requires a servlet request");
        }
        Account<?> account = RequestAccounts.requireAccount(request);
        if (!parameter.getParameterType().isInstance(account)) {
            throw new IllegalStateException("bound account is a " + account.getClass().getName()
                    + ", parameter expects " + parameter.getParameterType().getName());
        }
        return account;
    }
}
