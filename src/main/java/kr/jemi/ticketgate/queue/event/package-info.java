@NamedInterface("event")
package kr.jemi.ticketgate.queue.event;

import org.springframework.modulith.NamedInterface;
