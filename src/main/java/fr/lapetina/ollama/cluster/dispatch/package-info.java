/**
 * Server selection and retrying dispatch of chat requests.
 */
package fr.lapetina.ollama.cluster.dispatch;
