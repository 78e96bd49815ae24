@NamedInterface("api")
package kr.jemi.ticketgate.inventory.api;

import org.springframework.modulith.NamedInterface;
