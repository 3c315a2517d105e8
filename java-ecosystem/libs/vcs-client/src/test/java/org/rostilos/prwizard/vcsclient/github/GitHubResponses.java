package org.rostilos.prwizard.vcsclient.github;

import okhttp3.MediaType;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Builds real OkHttp responses for mocked calls.
 */
public final class GitHubResponses {

    private static final MediaType JSON = MediaType.parse("application/json");

    private GitHubResponses() {
    }

    public static Response json(Request request, int code, String body) {
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(code)
                .message(code < 300 ? "OK" : "Error")
                .body(ResponseBody.create(body, JSON))
                .build();
    }
}
