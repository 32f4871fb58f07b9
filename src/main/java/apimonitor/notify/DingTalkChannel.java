package apimonitor.notify;

import com.dingtalk.api.DefaultDingTalkClient;
import com.dingtalk.api.DingTalkClient;
import com.dingtalk.api.request.OapiRobotSendRequest;
import com.dingtalk.api.response.OapiRobotSendResponse;
import com.taobao.api.ApiException;
import org.apache.commons.lang3.StringUtils;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * 钉钉机器人通知渠道
 */
public class DingTalkChannel extends NotificationChannel {
    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.of("Asia/Shanghai"));

    private final DingTalkClient client;

    public DingTalkChannel(String webhookUrl, List<String> recipients) {
        this(new DefaultDingTalkClient(requireUrl(webhookUrl)), recipients);
    }

    DingTalkChannel(DingTalkClient client, List<String> recipients) {
        super(ChannelType.DINGTALK, recipients);
        this.client = client;
    }

    private static String requireUrl(String webhookUrl) {
        if (StringUtils.isBlank(webhookUrl)) {
            throw new IllegalArgumentException("钉钉webhook地址不能为空");
        }
        return webhookUrl;
    }

    @Override
    public void send(NotificationMessage message) throws NotificationException {
        OapiRobotSendRequest request = buildRequest(message);
        OapiRobotSendResponse response;
        try {
            response = client.execute(request);
        } catch (ApiException e) {
            throw new NotificationException("钉钉机器人发送失败: " + e.getErrMsg(), e);
        }
        if (response == null || !response.isSuccess()) {
            throw new NotificationException("钉钉机器人返回错误: "
                    + (response == null ? "empty response" : response.getErrcode() + " " + response.getErrmsg()));
        }
    }

    OapiRobotSendRequest buildRequest(NotificationMessage message) {
        OapiRobotSendRequest request = new OapiRobotSendRequest();
        request.setMsgtype("markdown");
        request.setMarkdown(buildMarkdown(message));
        if (!recipients.isEmpty()) {
            request.setAt(buildAt());
        }
        return request;
    }

    OapiRobotSendRequest.Markdown buildMarkdown(NotificationMessage message) {
        boolean failure = message.getKind() == NotificationKind.FAILURE;
        OapiRobotSendRequest.Markdown markdown = new OapiRobotSendRequest.Markdown();
        markdown.setTitle(failure ? "【告警】接口监控告警" : "【恢复】接口监控恢复");

        StringBuilder mentions = new StringBuilder();
        for (String recipient : recipients) {
            mentions.append("@").append(recipient).append(" ");
        }
        markdown.setText("# " + message.getSubject() + "\n\n" +
                "**端点**: " + message.getEndpointName() + "  \n\n" +
                "**地址**: " + message.getMethod() + " " + message.getUrl() + "  \n\n" +
                "**时间**: " + TIME_FORMAT.format(message.getCheckedAt()) + "  \n\n" +
                "**描述**: " + message.getBody() + "\n\n" +
                (recipients.isEmpty() ? "" : "**负责人**: " + mentions + "\n\n") +
                "---\n");
        return markdown;
    }

    /**
     * 按手机号@负责人
     */
    OapiRobotSendRequest.At buildAt() {
        OapiRobotSendRequest.At at = new OapiRobotSendRequest.At();
        at.setAtMobiles(recipients);
        return at;
    }
}
