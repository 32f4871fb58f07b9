package apimonitor.notify;

import com.dingtalk.api.DingTalkClient;
import com.dingtalk.api.request.OapiRobotSendRequest;
import com.dingtalk.api.response.OapiRobotSendResponse;
import com.taobao.api.ApiException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DingTalkChannelTest {

    private DingTalkClient client;
    private NotificationMessage failure;

    @BeforeEach
    void setUp() {
        client = mock(DingTalkClient.class);
        failure = NotificationMessage.builder()
                .kind(NotificationKind.FAILURE)
                .endpointId(2)
                .endpointName("gateway")
                .url("https://gateway.example.com/ping")
                .method("GET")
                .checkedAt(Instant.parse("2024-01-01T00:00:00Z"))
                .subject("🚨 Alert: gateway is DOWN")
                .body("Endpoint gateway is unreachable. Error: Connection error: refused")
                .build();
    }

    @Test
    void buildsMarkdownWithMentions() {
        DingTalkChannel channel = new DingTalkChannel(client, List.of("13800000000"));

        OapiRobotSendRequest.Markdown markdown = channel.buildMarkdown(failure);

        assertThat(markdown.getTitle()).isEqualTo("【告警】接口监控告警");
        assertThat(markdown.getText())
                .startsWith("# 🚨 Alert: gateway is DOWN")
                .contains("GET https://gateway.example.com/ping")
                .contains("2024-01-01 08:00:00")
                .contains("@13800000000");
        assertThat(channel.buildAt().getAtMobiles()).containsExactly("13800000000");
        assertThat(channel.buildRequest(failure).getMsgtype()).isEqualTo("markdown");
    }

    @Test
    void recoveryWithoutRecipientsHasNoMentions() {
        DingTalkChannel channel = new DingTalkChannel(client, List.of());
        NotificationMessage recovery = NotificationMessage.builder()
                .kind(NotificationKind.RECOVERY)
                .endpointName("gateway")
                .url("https://gateway.example.com/ping")
                .method("GET")
                .checkedAt(Instant.parse("2024-01-01T00:00:00Z"))
                .subject("✅ Recovery: gateway is back online")
                .body("gateway is back online!")
                .build();

        OapiRobotSendRequest.Markdown markdown = channel.buildMarkdown(recovery);

        assertThat(markdown.getTitle()).isEqualTo("【恢复】接口监控恢复");
        assertThat(markdown.getText()).doesNotContain("负责人");
        assertThat(channel.buildRequest(recovery).getAt()).isNull();
    }

    @Test
    void sendsThroughClient() throws ApiException {
        OapiRobotSendResponse response = mock(OapiRobotSendResponse.class);
        when(response.isSuccess()).thenReturn(true);
        when(client.execute(any(OapiRobotSendRequest.class))).thenReturn(response);

        new DingTalkChannel(client, List.of()).send(failure);

        verify(client).execute(any(OapiRobotSendRequest.class));
    }

    @Test
    void robotErrorCodeFails() throws ApiException {
        OapiRobotSendResponse response = mock(OapiRobotSendResponse.class);
        when(response.isSuccess()).thenReturn(false);
        when(response.getErrcode()).thenReturn(310000L);
        when(response.getErrmsg()).thenReturn("keywords not in content");
        when(client.execute(any(OapiRobotSendRequest.class))).thenReturn(response);

        assertThatThrownBy(() -> new DingTalkChannel(client, List.of()).send(failure))
                .isInstanceOf(NotificationException.class)
                .hasMessageContaining("310000")
                .hasMessageContaining("keywords not in content");
    }

    @Test
    void clientExceptionIsWrapped() throws ApiException {
        when(client.execute(any(OapiRobotSendRequest.class))).thenThrow(new ApiException("network down"));

        assertThatThrownBy(() -> new DingTalkChannel(client, List.of()).send(failure))
                .isInstanceOf(NotificationException.class)
                .hasCauseInstanceOf(ApiException.class);
    }

    @Test
    void blankWebhookUrlIsRejected() {
        assertThatThrownBy(() -> new DingTalkChannel(" ", List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
