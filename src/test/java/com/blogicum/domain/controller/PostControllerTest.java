package com.blogicum.domain.controller;

import com.blogicum.auth.config.AuthProperties;
import com.blogicum.auth.service.JwtService;
import com.blogicum.auth.web.AccessTokenInterceptor;
import com.blogicum.common.api.BlogException;
import com.blogicum.common.web.GlobalExceptionHandler;
import com.blogicum.domain.config.PaginationProperties;
import com.blogicum.domain.dto.PageResult;
import com.blogicum.domain.dto.PostScope;
import com.blogicum.domain.dto.PostView;
import com.blogicum.domain.enums.AccessDecision;
import com.blogicum.domain.enums.DenialMode;
import com.blogicum.domain.policy.AccessDeniedException;
import com.blogicum.domain.policy.Viewer;
import com.blogicum.domain.service.PostQueryService;
import com.blogicum.domain.service.PostService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class PostControllerTest {

    private final JwtService jwtService = new JwtService(
            new AuthProperties("blogicum", "test-secret-test-secret-test-secret-0123456789", 3600), Clock.systemUTC());

    private PostQueryService postQueryService;
    private PostService postService;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        postQueryService = mock(PostQueryService.class);
        postService = mock(PostService.class);
        mvc = MockMvcBuilders
                .standaloneSetup(new PostController(postQueryService, postService, new PaginationProperties(10)))
                .setControllerAdvice(new GlobalExceptionHandler())
                .addInterceptors(new AccessTokenInterceptor(jwtService, new ObjectMapper()))
                .build();
    }

    private String bearer(long accountId) {
        return "Bearer " + jwtService.issueAccessToken(accountId, false);
    }

    @Test
    void index_ShouldPassViewerAndConfiguredPageSize() throws Exception {
        when(postQueryService.page(any(), any(), eq(2), eq(10)))
                .thenReturn(new PageResult<PostView>(List.of(), 2, 10, 0, false));

        mvc.perform(get("/posts").param("page", "2").header("Authorization", bearer(7)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true));

        verify(postQueryService).page(eq(Viewer.of(7, false)), eq(PostScope.all()), eq(2), eq(10));
    }

    @Test
    void detail_HiddenPost_ShouldBe404() throws Exception {
        when(postService.detail(any(), anyLong())).thenThrow(BlogException.notFound());

        mvc.perform(get("/posts/5"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("not_found"));
    }

    @Test
    void delete_ByNonOwnerInRedirectMode_ShouldRedirectToPostDetail() throws Exception {
        doThrow(new AccessDeniedException(AccessDecision.DENIED_NOT_OWNER, DenialMode.REDIRECT, 5))
                .when(postService).delete(any(), eq(5L));

        mvc.perform(delete("/posts/5").header("Authorization", bearer(8)))
                .andExpect(status().isSeeOther())
                .andExpect(header().string("Location", "/posts/5"));
    }

    @Test
    void edit_MalformedPubDate_ShouldBe400() throws Exception {
        mvc.perform(put("/posts/5")
                        .header("Authorization", bearer(8))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\":\"t\",\"text\":\"b\",\"pubDate\":\"next tuesday\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("malformed_request"));

        verifyNoInteractions(postService);
    }

    @Test
    void badToken_ShouldBe401BeforeReachingController() throws Exception {
        mvc.perform(delete("/posts/5").header("Authorization", "Bearer garbage"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(postService);
    }
}
