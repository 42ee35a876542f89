/**
 * Slack Web API client.
 *
 * <pre>{@code
 * WebClient client = WebClient.builder().token(System.getenv("SLACK_BOT_TOKEN")).build();
 * SlackResponse response = client.chatPostMessage("#random", "Hello!");
 *
 * for (SlackResponse page : client.paginate("conversations.list", Map.of("limit", 100))) {
 *     page.getList("channels").forEach(System.out::println);
 * }
 * }</pre>
 */
package fr.lapetina.slack.web;
