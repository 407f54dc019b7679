package de.htwsaar.ministatic.server.domain;

/**
 * Einziger Body-Aufbau aller Fehlerantworten.
 *
 * @param status        HTTP-Statuscode
 * @param statusMessage Standardtext des Statuscodes
 * @param message       Beschreibung des konkreten Fehlers
 */
public record ErrorPayload(int status, String statusMessage, String message) {}
