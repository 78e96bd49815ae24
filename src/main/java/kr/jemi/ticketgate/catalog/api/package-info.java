@NamedInterface("api")
package kr.jemi.ticketgate.catalog.api;

import org.springframework.modulith.NamedInterface;
