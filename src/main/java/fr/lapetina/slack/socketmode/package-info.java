/**
 * Socket Mode client.
 */
package fr.lapetina.slack.socketmode;
