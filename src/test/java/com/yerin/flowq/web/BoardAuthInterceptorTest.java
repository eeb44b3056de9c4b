package com.yerin.flowq.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.*;

@DisplayName("보드 Basic 인증 인터셉터 테스트")
public class BoardAuthInterceptorTest {

    private static String basic(String user, String password) {
        return "Basic " + Base64.getEncoder().encodeToString((user + ":" + password).getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("인증 헤더가 없으면 401로 차단")
    void blocks_when_header_missing() throws Exception {
        var inter = new BoardAuthInterceptor("admin", "secret");
        var req = new MockHttpServletRequest();
        var res = new MockHttpServletResponse();

        boolean pass = inter.preHandle(req, res, new Object());

        assertThat(pass).isFalse();
        assertThat(res.getStatus()).isEqualTo(401);
        assertThat(res.getHeader("WWW-Authenticate")).startsWith("Basic");
    }

    @Test
    @DisplayName("비밀번호가 틀리면 401")
    void blocks_wrong_password() throws Exception {
        var inter = new BoardAuthInterceptor("admin", "secret");
        var req = new MockHttpServletRequest();
        req.addHeader("Authorization", basic("admin", "nope"));
        var res = new MockHttpServletResponse();

        assertThat(inter.preHandle(req, res, new Object())).isFalse();
        assertThat(res.getStatus()).isEqualTo(401);
    }

    @Test
    @DisplayName("자격 증명이 일치하면 통과")
    void passes_when_credentials_match() throws Exception {
        var inter = new BoardAuthInterceptor("admin", "secret");
        var req = new MockHttpServletRequest();
        req.addHeader("Authorization", basic("admin", "secret"));
        var res = new MockHttpServletResponse();

        assertThat(inter.preHandle(req, res, new Object())).isTrue();
        assertThat(res.getStatus()).isEqualTo(200);
    }

    @Test
    @DisplayName("비밀번호가 설정되지 않았으면 모든 요청을 거절")
    void blocks_everything_without_configured_password() throws Exception {
        var inter = new BoardAuthInterceptor("admin", "");
        var req = new MockHttpServletRequest();
        req.addHeader("Authorization", basic("admin", ""));
        var res = new MockHttpServletResponse();

        assertThat(inter.preHandle(req, res, new Object())).isFalse();
    }
}
