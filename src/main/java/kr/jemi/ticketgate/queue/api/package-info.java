@NamedInterface("api")
package kr.jemi.ticketgate.queue.api;

import org.springframework.modulith.NamedInterface;
