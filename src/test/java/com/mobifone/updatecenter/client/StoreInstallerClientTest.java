package com.mobifone.updatecenter.client;

import com.mobifone.updatecenter.dto.request.InstallManifest;
import com.mobifone.updatecenter.dto.response.ProgressSnapshot;
import com.mobifone.updatecenter.entity.enumeration.HandleState;
import com.mobifone.updatecenter.exception.AppException;
import com.mobifone.updatecenter.exception.ErrorCode;
import com.mobifone.updatecenter.webClient.ApiStrategyFactory;
import com.mobifone.updatecenter.webClient.StoreApiStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("StoreInstallerClient over a stubbed WebClient exchange")
class StoreInstallerClientTest {

    private final List<ClientRequest> requests = new ArrayList<>();

    private StoreInstallerClient clientReturning(HttpStatus status, String body) {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            ClientResponse.Builder response = ClientResponse.create(status)
                    .header(HttpHeaders.CONTENT_TYPE, "application/json");
            if (body != null) response.body(body);
            return Mono.just(response.build());
        });
        StoreApiStrategy strategy = new StoreApiStrategy(builder, "http://store.test/api", "secret", 5);
        return new StoreInstallerClient(new ApiStrategyFactory(List.of(strategy)));
    }

    private InstallManifest manifest() {
        return InstallManifest.builder()
                .name("Update Center Batch Install")
                .packages(List.of(InstallManifest.ManifestPackage.builder()
                        .id("pkg-1").type("application").requestedVersion("2.0.0").build()))
                .build();
    }

    @Test
    void submit_returnsHandleFromResponse() {
        StoreInstallerClient client = clientReturning(HttpStatus.OK, "{\"result\":{\"progress_id\":\"pw-42\"}}");

        String handle = client.submit(manifest());

        assertThat(handle).isEqualTo("pw-42");
        ClientRequest sent = requests.get(0);
        assertThat(sent.method()).isEqualTo(HttpMethod.POST);
        assertThat(sent.url().toString()).isEqualTo("http://store.test/api/installer/batch/install");
        assertThat(sent.headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer secret");
    }

    @Test
    void submit_acceptsCamelCaseHandleField() {
        assertThat(clientReturning(HttpStatus.OK, "{\"progressId\":\"pw-7\"}").submit(manifest())).isEqualTo("pw-7");
    }

    @Test
    void submit_serverError_isSubmissionFailure() {
        StoreInstallerClient client = clientReturning(HttpStatus.INTERNAL_SERVER_ERROR, "{\"error\":\"boom\"}");

        assertThatThrownBy(() -> client.submit(manifest()))
                .isInstanceOf(AppException.class)
                .matches(e -> ((AppException) e).getErrorCode() == ErrorCode.INSTALLER_SUBMISSION_FAILED);
    }

    @Test
    void submit_responseWithoutHandle_isSubmissionFailure() {
        StoreInstallerClient client = clientReturning(HttpStatus.OK, "{\"status\":\"queued\"}");

        assertThatThrownBy(() -> client.submit(manifest()))
                .isInstanceOf(AppException.class)
                .hasMessageContaining("no progress handle");
    }

    @Test
    void readHandle_notFound_isEmpty() {
        StoreInstallerClient client = clientReturning(HttpStatus.NOT_FOUND, null);

        assertThat(client.readHandle("pw-1")).isEmpty();
        assertThat(requests.get(0).url().getPath()).isEqualTo("/api/installer/progress/pw-1");
    }

    @Test
    void readHandle_parsesSnapshot() {
        StoreInstallerClient client = clientReturning(HttpStatus.OK, "{"
                + "\"id\":\"pw-1\",\"state\":\"complete\",\"message\":\"Batch install finished\","
                + "\"percent_complete\":100,\"error_message\":\"\",\"output_summary\":\"3 installed\","
                + "\"total_messages\":12}");

        Optional<ProgressSnapshot> snap = client.readHandle("pw-1");

        assertThat(snap).isPresent();
        assertThat(snap.get().getState()).isEqualTo(HandleState.COMPLETE);
        assertThat(snap.get().percentOrZero()).isEqualTo(100);
        assertThat(snap.get().getOutputSummary()).isEqualTo("3 installed");
    }

    @Test
    void readHandle_serverError_isReported() {
        StoreInstallerClient client = clientReturning(HttpStatus.BAD_GATEWAY, "oops");

        assertThatThrownBy(() -> client.readHandle("pw-1"))
                .isInstanceOf(AppException.class)
                .matches(e -> ((AppException) e).getErrorCode() == ErrorCode.INSTALLER_UNAVAILABLE);
    }
}
